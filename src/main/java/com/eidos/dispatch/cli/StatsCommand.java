package com.eidos.dispatch.cli;

import com.eidos.core.persistence.EpisodicStore;
import com.eidos.core.persistence.StoreStats;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: eidos stats
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show store counts")
@Component
public class StatsCommand implements Runnable {

    private final EpisodicStore store;

    public StatsCommand(EpisodicStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        StoreStats stats = store.getStats();
        ConsoleOutput.info("Database: " + stats.dbPath());
        System.out.printf("  %-28s %d%n", "Episodes", stats.episodes());
        System.out.printf("  %-28s %d%n", "Steps", stats.steps());
        System.out.printf("  %-28s %d%n", "Distillations", stats.distillations());
        System.out.printf("  %-28s %d%n", "High-confidence distillations", stats.highConfidenceDistillations());
        System.out.printf("  %-28s %d%n", "Archived distillations", stats.archivedDistillations());
        System.out.printf("  %-28s %d%n", "Policies", stats.policies());
        System.out.printf("  %-28s %.1f%%%n", "Success rate", stats.successRate() * 100.0);
    }
}
