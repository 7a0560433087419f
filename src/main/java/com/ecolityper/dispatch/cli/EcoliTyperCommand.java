package com.ecolityper.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for EcoliTyper.
 * Routes to subcommands: run, health.
 */
@Command(
        name = "ecolityper",
        mixinStandardHelpOptions = true,
        version = "EcoliTyper 0.1.0",
        description = "Comprehensive E. coli typing: MLST, serotyping, CH typing, phylogrouping, ABRicate, AMRFinderPlus",
        subcommands = {
                RunCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class EcoliTyperCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
