package com.eidos.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for EIDOS.
 * Routes to subcommands: stats, episodes, distill, revalidate, curriculum, autofix.
 */
@Command(
        name = "eidos",
        mixinStandardHelpOptions = true,
        version = "EIDOS 0.1.0",
        description = "Episodic learning store: distill episodes into rules and refine them",
        subcommands = {
                StatsCommand.class,
                EpisodesCommand.class,
                DistillCommand.class,
                RevalidateCommand.class,
                CurriculumCommand.class,
                AutofixCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class EidosCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
