package com.eidos.core.curriculum;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link CurriculumReport} as a Markdown runbook.
 */
@Component
public class CurriculumMarkdownRenderer {

    public String render(CurriculumReport report, int maxCards) {
        CurriculumStats stats = report.stats();
        List<String> lines = new ArrayList<>();
        lines.add("# EIDOS Distillation Curriculum");
        lines.add("");
        lines.add("- DB: `" + report.dbPath() + "`");
        lines.add("- Rows scanned: `" + stats.rowsScanned() + "`");
        lines.add("- Cards generated: `" + stats.cardsGenerated() + "`");
        lines.add("");

        if (!stats.gaps().isEmpty()) {
            lines.add("## Gap Summary");
            lines.add("");
            stats.gaps().entrySet().stream()
                    .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                            .thenComparing(Map.Entry.comparingByKey()))
                    .forEach(e -> lines.add("- `" + e.getKey() + "`: " + e.getValue()));
            lines.add("");
            if (!report.gapSummary().isBlank()) {
                lines.add(report.gapSummary().strip());
                lines.add("");
            }
        }

        lines.add("## Top Question Cards");
        lines.add("");
        List<GapCard> cards = report.cards();
        int shown = Math.min(cards.size(), Math.max(1, maxCards));
        for (int i = 0; i < shown; i++) {
            GapCard card = cards.get(i);
            lines.add("### " + (i + 1) + ". " + card.gap().value() + " (" + card.severity().value() + ")");
            lines.add("- Distillation: `" + card.distillationId() + "` (" + card.source() + ")");
            lines.add("- Question: " + card.question());
            lines.add("- Clear answer: " + card.clearAnswer());
            lines.add("- Recommended loop: `" + card.recommendedLoop().value() + "`");
            lines.add("- Why: " + card.why());
            lines.add("");
        }
        return String.join("\n", lines);
    }
}
