package com.markrunner.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for markrunner.
 * Routes to subcommands: batch, pipeline, status, errors, force-complete, health.
 */
@Command(
        name = "markrunner",
        mixinStandardHelpOptions = true,
        version = "Markrunner 0.1.0",
        description = "Resumable parallel runner for batches of CLI assistant invocations",
        subcommands = {
                BatchCommand.class,
                PipelineCommand.class,
                StatusCommand.class,
                ErrorsCommand.class,
                ForceCompleteCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MarkrunnerCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
