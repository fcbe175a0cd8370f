package com.eidos.dispatch.cli;

import com.eidos.core.distillation.DistillationService;
import com.eidos.core.model.Distillation;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: eidos revalidate
 * <p>
 * Lists distillations whose revalidation date has passed.
 */
@Command(name = "revalidate", mixinStandardHelpOptions = true,
        description = "List distillations due for revalidation")
@Component
public class RevalidateCommand implements Runnable {

    private final DistillationService distillationService;

    public RevalidateCommand(DistillationService distillationService) {
        this.distillationService = distillationService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<Distillation> due = distillationService.dueForRevalidation();
        if (due.isEmpty()) {
            ConsoleOutput.success("Nothing due for revalidation.");
            return;
        }
        ConsoleOutput.info("Due for revalidation (" + due.size() + "):");
        System.out.println();
        System.out.printf("  %-14s %-12s %-6s %s%n", "ID", "TYPE", "CONF", "STATEMENT");
        System.out.println("  " + "-".repeat(76));
        for (Distillation d : due) {
            System.out.printf("  %-14s %-12s %-6.2f %s%n", d.getDistillationId(), d.getType().value(),
                    d.getConfidence(), ConsoleOutput.truncate(d.getStatement(), 40));
        }
    }
}
