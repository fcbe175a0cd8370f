package com.eidos.dispatch.cli;

import com.eidos.core.distillation.DistillationOutcome;
import com.eidos.core.distillation.DistillationService;
import com.eidos.core.model.Distillation;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: eidos distill &lt;episode-id&gt;
 */
@Command(name = "distill", mixinStandardHelpOptions = true,
        description = "Reflect on a finished episode and store its distillations")
@Component
public class DistillCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Episode ID")
    private String episodeId;

    private final DistillationService distillationService;

    public DistillCommand(DistillationService distillationService) {
        this.distillationService = distillationService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        DistillationOutcome outcome;
        try {
            outcome = distillationService.distillEpisode(episodeId);
        } catch (IllegalArgumentException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Episode " + episodeId + ": " + outcome.stepsUsed() + " steps reflected");
        if (!outcome.reflection().keyInsight().isBlank()) {
            ConsoleOutput.info("Key insight: " + outcome.reflection().keyInsight());
        }
        for (Distillation d : outcome.created()) {
            ConsoleOutput.success("new " + d.getType().value() + " " + d.getDistillationId() + ": "
                    + ConsoleOutput.truncate(d.getStatement(), 70));
        }
        for (Distillation d : outcome.reinforced()) {
            ConsoleOutput.info("reinforced " + d.getDistillationId() + " (validations: "
                    + d.getValidationCount() + ")");
        }
        if (outcome.created().isEmpty() && outcome.reinforced().isEmpty()) {
            ConsoleOutput.warn("No distillations produced.");
        }
        return 0;
    }
}
