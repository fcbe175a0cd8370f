package com.eidos.core.curriculum;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CurriculumMarkdownRendererTest {

    private final CurriculumMarkdownRenderer renderer = new CurriculumMarkdownRenderer();

    private static GapCard card(String id, GapType gap, Severity severity, RecommendedLoop loop) {
        return new GapCard("distillations:" + id + ":" + gap.value(), id, "heuristic", "distillations",
                gap, severity, loop, "When x: do y", "because", "");
    }

    private static CurriculumReport report(List<GapCard> cards, Map<String, Integer> gaps, String summary) {
        return new CurriculumReport(1_700_000_000L, "/tmp/eidos.db",
                new CurriculumStats(7, cards.size(), gaps, Map.of("high", 1)), cards, summary, "");
    }

    @Test
    @DisplayName("renders header, gap summary sorted by count and numbered cards")
    void fullReport() {
        Map<String, Integer> gaps = new LinkedHashMap<>();
        gaps.put("low_reasoning", 1);
        gaps.put("suppressed_statement", 3);
        List<GapCard> cards = List.of(
                card("d1", GapType.SUPPRESSED_STATEMENT, Severity.HIGH, RecommendedLoop.DETERMINISTIC_THEN_LLM),
                card("d2", GapType.LOW_REASONING, Severity.MEDIUM, RecommendedLoop.DETERMINISTIC_THEN_LLM));

        String md = renderer.render(report(cards, gaps, ""), 30);

        assertTrue(md.startsWith("# EIDOS Distillation Curriculum\n"));
        assertTrue(md.contains("- DB: `/tmp/eidos.db`"));
        assertTrue(md.contains("- Rows scanned: `7`"));
        assertTrue(md.contains("- Cards generated: `2`"));
        assertTrue(md.indexOf("`suppressed_statement`: 3") < md.indexOf("`low_reasoning`: 1"));
        assertTrue(md.contains("### 1. suppressed_statement (high)"));
        assertTrue(md.contains("### 2. low_reasoning (medium)"));
        assertTrue(md.contains("- Distillation: `d1` (distillations)"));
        assertTrue(md.contains("- Question: " + GapType.SUPPRESSED_STATEMENT.question()));
        assertTrue(md.contains("- Clear answer: " + GapType.SUPPRESSED_STATEMENT.clearAnswer()));
        assertTrue(md.contains("- Recommended loop: `deterministic_then_llm`"));
    }

    @Test
    @DisplayName("card list is capped and the gap section is omitted when there are no gaps")
    void capAndEmptyGaps() {
        List<GapCard> cards = List.of(
                card("d1", GapType.LOW_SPECIFICITY, Severity.MEDIUM, RecommendedLoop.DETERMINISTIC_ONLY),
                card("d2", GapType.LOW_SPECIFICITY, Severity.MEDIUM, RecommendedLoop.DETERMINISTIC_ONLY));

        String md = renderer.render(report(cards, Map.of(), ""), 1);

        assertFalse(md.contains("## Gap Summary"));
        assertTrue(md.contains("## Top Question Cards"));
        assertTrue(md.contains("### 1. low_specificity"));
        assertFalse(md.contains("### 2."));
    }

    @Test
    @DisplayName("narrative summary follows the gap counts")
    void narrative() {
        String md = renderer.render(report(List.of(), Map.of("low_reasoning", 2), "Reasons are missing."), 10);
        assertTrue(md.indexOf("Reasons are missing.") > md.indexOf("`low_reasoning`: 2"));
    }
}
