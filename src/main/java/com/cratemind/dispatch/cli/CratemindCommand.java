package com.cratemind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Cratemind.
 * Routes to subcommands: classify, inspect.
 */
@Command(
        name = "cratemind",
        mixinStandardHelpOptions = true,
        version = "Cratemind 0.1.0",
        description = "Sorts your tracks into Dance Pop, House and Bass crates using an LLM",
        subcommands = {
                ClassifyCommand.class,
                InspectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CratemindCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
