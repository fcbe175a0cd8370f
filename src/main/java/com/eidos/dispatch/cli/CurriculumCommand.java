package com.eidos.dispatch.cli;

import com.eidos.core.curriculum.CurriculumBuilder;
import com.eidos.core.curriculum.CurriculumMarkdownRenderer;
import com.eidos.core.curriculum.CurriculumReport;
import com.eidos.core.curriculum.CurriculumSnapshotStore;
import com.eidos.core.curriculum.GapCard;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: eidos curriculum
 * <p>
 * Builds the gap-card curriculum, prints the top cards and optionally writes
 * JSON / Markdown renditions and a history snapshot.
 */
@Command(name = "curriculum", mixinStandardHelpOptions = true,
        description = "Build prioritized question cards from stored distillations")
@Component
public class CurriculumCommand implements Callable<Integer> {

    @Option(names = "--max-rows", description = "Active rows to scan (default: ${DEFAULT-VALUE})",
            defaultValue = "300")
    private int maxRows;

    @Option(names = "--max-cards", description = "Cards to keep (default: ${DEFAULT-VALUE})",
            defaultValue = "200")
    private int maxCards;

    @Option(names = "--no-archive", description = "Skip the archive table")
    private boolean noArchive;

    @Option(names = "--json-out", description = "Write the report as JSON")
    private Path jsonOut;

    @Option(names = "--md-out", description = "Write the report as Markdown")
    private Path mdOut;

    @Option(names = "--save", description = "Save the latest snapshot and append to history")
    private boolean save;

    @Option(names = "--show", description = "Cards to print (default: ${DEFAULT-VALUE})", defaultValue = "10")
    private int show;

    private final CurriculumBuilder builder;
    private final CurriculumMarkdownRenderer renderer;
    private final CurriculumSnapshotStore snapshots;

    public CurriculumCommand(CurriculumBuilder builder, CurriculumMarkdownRenderer renderer,
                             CurriculumSnapshotStore snapshots) {
        this.builder = builder;
        this.renderer = renderer;
        this.snapshots = snapshots;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        CurriculumReport report = builder.build(maxRows, maxCards, !noArchive);
        if (report.hasError()) {
            ConsoleOutput.error("Curriculum failed for " + report.dbPath() + ": " + report.error());
            return 1;
        }

        ConsoleOutput.info("Scanned " + report.stats().rowsScanned() + " rows, "
                + report.stats().cardsGenerated() + " cards " + report.stats().severity());
        report.cards().stream().limit(Math.max(0, show)).forEach(this::printCard);
        if (!report.gapSummary().isBlank()) {
            System.out.println();
            ConsoleOutput.info(report.gapSummary());
        }

        try {
            if (jsonOut != null) {
                ConsoleOutput.writeJson(jsonOut, report.toMap());
                ConsoleOutput.success("JSON written to " + jsonOut);
            }
            if (mdOut != null) {
                ConsoleOutput.writeText(mdOut, renderer.render(report, 30));
                ConsoleOutput.success("Markdown written to " + mdOut);
            }
            if (save) {
                CurriculumSnapshotStore.HistoryRow row = snapshots.save(report);
                ConsoleOutput.success("Snapshot saved (" + row.date() + ", " + row.high() + " high)");
            }
        } catch (IOException | UncheckedIOException e) {
            ConsoleOutput.error("Could not write output: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    private void printCard(GapCard card) {
        ConsoleOutput.severity(card.severity().value(), card.gap().value() + " "
                + card.distillationId() + " (" + card.source() + "): "
                + ConsoleOutput.truncate(card.statement(), 60));
    }
}
