package com.eidos.dispatch.cli;

import com.eidos.core.model.Episode;
import com.eidos.core.persistence.EpisodicStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: eidos episodes
 * <p>
 * Lists the most recent episodes as a table: Episode ID | Outcome | Phase | Steps | Goal.
 */
@Command(name = "episodes", mixinStandardHelpOptions = true, description = "List recent episodes")
@Component
public class EpisodesCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final EpisodicStore store;

    public EpisodesCommand(EpisodicStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Episode> episodes = store.getRecentEpisodes(limit);
        if (episodes.isEmpty()) {
            ConsoleOutput.info("No episodes found.");
            return;
        }

        ConsoleOutput.info("Episodes (" + episodes.size() + "):");
        System.out.println();
        System.out.printf("  %-14s %-12s %-12s %-6s %s%n", "EPISODE ID", "OUTCOME", "PHASE", "STEPS", "GOAL");
        System.out.println("  " + "-".repeat(76));
        for (Episode e : episodes) {
            System.out.printf("  %-14s %-12s %-12s %-6d %s%n",
                    e.getEpisodeId(), e.getOutcome().value(), e.getPhase().value(),
                    e.getStepCount(), ConsoleOutput.truncate(e.getGoal(), 30));
        }
    }
}
