package com.jsgf.tools.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; does nothing by itself except list its subcommands.
 */
@Command(
        name = "jsgf",
        mixinStandardHelpOptions = true,
        version = "jsgf-tools 2.0.0",
        description = "Parses JSGF grammars and generates strings from them.",
        subcommands = {
                DeterministicCommand.class,
                ProbabilisticCommand.class,
                InfoCommand.class
        }
)
public class JsgfCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.err);
    }
}
