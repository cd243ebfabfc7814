package com.jsgf.tools.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "info" command.
 */
@Getter
public class InfoOptions {

	@Parameters(index = "0", paramLabel = "GRAMMAR_FILE", description = "Path to the JSGF grammar file")
	private Path grammarFile;

	@Option(names = { "--verbose", "-v" }, description = "Show detailed information")
	private boolean verbose;
}
