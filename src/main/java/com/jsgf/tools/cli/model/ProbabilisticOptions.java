package com.jsgf.tools.cli.model;

import java.nio.file.Path;

import com.jsgf.tools.generator.GeneratorConfig;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "probabilistic" command.
 */
@Getter
public class ProbabilisticOptions {

	@Parameters(index = "0", paramLabel = "GRAMMAR_FILE", description = "Path to the JSGF grammar file")
	private Path grammarFile;

	@Parameters(index = "1", paramLabel = "COUNT", description = "Number of strings to generate")
	private int count;

	@Option(names = { "--rule", "-r" }, description = "Specific rule to generate from (default: all public rules)")
	private String rule;

	@Option(names = { "--seed", "-s" }, description = "Random seed for reproducible results")
	private Long seed;

	@Option(names = { "--max-recursion",
			"-d" }, defaultValue = "" + GeneratorConfig.DEFAULT_MAX_RECURSION_DEPTH, description = "Maximum recursion depth (default: ${DEFAULT-VALUE})")
	private int maxRecursion;

	@Option(names = { "--output", "-o" }, description = "Output file (default: stdout)")
	private Path output;
}
