package com.jsgf.tools;

import com.jsgf.tools.cli.JsgfCommand;
import picocli.CommandLine;

/**
 * Main entry point for JSGF Tools.
 * Parses JSGF grammar files and prints strings generated from them, either every
 * possible string or a random sample.
 */
public class JsgfToolsApplication {

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new JsgfCommand()).execute(args);
    }
}
