package com.magicfolder.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: serve, classify, health.
 */
@Command(
        name = "magicfolder",
        mixinStandardHelpOptions = true,
        version = "MagicFolder Classifier 0.1.0",
        description = "Local file-classification service for MagicFolder",
        subcommands = {
                ServeCommand.class,
                ClassifyCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MagicFolderCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
