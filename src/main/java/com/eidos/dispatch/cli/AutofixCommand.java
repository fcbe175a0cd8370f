package com.eidos.dispatch.cli;

import com.eidos.core.curriculum.AutofixOptions;
import com.eidos.core.curriculum.AutofixReport;
import com.eidos.core.curriculum.AutofixRow;
import com.eidos.core.curriculum.CurriculumAutofixService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: eidos autofix
 * <p>
 * Re-refines the top curriculum targets. Dry run unless {@code --apply} is given.
 */
@Command(name = "autofix", mixinStandardHelpOptions = true,
        description = "Re-run refinement on the highest-priority curriculum cards")
@Component
public class AutofixCommand implements Callable<Integer> {

    @Option(names = "--max-cards", description = "Rows to attempt (default: ${DEFAULT-VALUE})", defaultValue = "5")
    private int maxCards;

    @Option(names = "--min-gain", description = "Unified score gain that counts as improved (default: ${DEFAULT-VALUE})",
            defaultValue = "0.03")
    private double minGain;

    @Option(names = "--apply", description = "Write improvements in one transaction")
    private boolean apply;

    @Option(names = "--include-archive", description = "Also target archived rows")
    private boolean includeArchive;

    @Option(names = "--promote", description = "Copy improved archive rows back into the active table")
    private boolean promote;

    @Option(names = "--promote-min-unified", description = "Floor for --promote (default: ${DEFAULT-VALUE})",
            defaultValue = "0.60")
    private double promoteMinUnified;

    @Option(names = "--soft-promote", description = "Tag improved archive rows as soft promoted")
    private boolean softPromote;

    @Option(names = "--soft-promote-min-unified", description = "Floor for --soft-promote (default: ${DEFAULT-VALUE})",
            defaultValue = "0.35")
    private double softPromoteMinUnified;

    @Option(names = "--no-archive-fallback", description = "Skip the second refinement pass for archive rows")
    private boolean noArchiveFallback;

    @Option(names = "--json-out", description = "Write the report as JSON")
    private Path jsonOut;

    private final CurriculumAutofixService autofixService;

    public AutofixCommand(CurriculumAutofixService autofixService) {
        this.autofixService = autofixService;
    }

    AutofixOptions options() {
        return AutofixOptions.builder()
                .maxCards(maxCards)
                .minGain(minGain)
                .apply(apply)
                .includeArchive(includeArchive)
                .promoteOnSuccess(promote)
                .promoteMinUnified(promoteMinUnified)
                .softPromoteOnSuccess(softPromote)
                .softPromoteMinUnified(softPromoteMinUnified)
                .archiveFallbackLlm(!noArchiveFallback)
                .build();
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        AutofixOptions options = options();
        if (!options.apply()) {
            ConsoleOutput.warn("Dry run: no changes will be written (use --apply)");
        }
        AutofixReport report = autofixService.run(options);
        if (report.hasError()) {
            ConsoleOutput.error("Autofix failed for " + report.dbPath() + ": " + report.error());
        }

        for (AutofixRow row : report.rows()) {
            ConsoleOutput.action(row.action().value(), String.format("%s (%s) %.2f -> %.2f%s",
                    row.distillationId(), row.source(), row.oldUnified(), row.newUnified(),
                    row.error().isEmpty() ? "" : " [" + row.error() + "]"));
        }
        ConsoleOutput.info("Attempted " + report.attempted() + " of " + report.candidates()
                + " candidates, updated " + report.updated()
                + (options.includeArchive() ? ", archive promoted " + report.archivePromoted() : ""));
        if (report.archiveStagnationDetected()) {
            ConsoleOutput.warn("Archive update rate " + report.archiveUpdateRate() + " is below "
                    + AutofixReport.STAGNATION_RATE);
        }

        if (jsonOut != null) {
            try {
                ConsoleOutput.writeJson(jsonOut, report.toMap());
                ConsoleOutput.success("JSON written to " + jsonOut);
            } catch (IOException e) {
                ConsoleOutput.error("Could not write " + jsonOut + ": " + e.getMessage());
                return 1;
            }
        }
        return report.hasError() ? 1 : 0;
    }
}
