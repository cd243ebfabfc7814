package com.jsgf.tools.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.jsgf.tools.cli.exception.OptionsValidationException;
import com.jsgf.tools.cli.model.DeterministicOptions;
import com.jsgf.tools.cli.model.InfoOptions;
import com.jsgf.tools.cli.model.ProbabilisticOptions;
import com.jsgf.tools.generator.GeneratorConfig;

/**
 * Checks command options before any grammar is read. Collects every problem and reports
 * them together.
 */
public class OptionsValidator {

	public void validate(DeterministicOptions o) {
		List<String> errors = new ArrayList<>();

		checkGrammarFile(o.getGrammarFile(), errors);
		checkMaxRecursion(o.getMaxRecursion(), errors);
		if (o.getMaxResults() != null && o.getMaxResults() <= 0) {
			errors.add("Maximum results must be > 0 (--max-results / -m). Got: " + o.getMaxResults());
		}
		checkOutput(o.getOutput(), errors);

		throwIfAny(errors);
	}

	public void validate(ProbabilisticOptions o) {
		List<String> errors = new ArrayList<>();

		checkGrammarFile(o.getGrammarFile(), errors);
		if (o.getCount() < 0) {
			errors.add("Count must be >= 0. Got: " + o.getCount());
		}
		checkMaxRecursion(o.getMaxRecursion(), errors);
		checkOutput(o.getOutput(), errors);

		throwIfAny(errors);
	}

	public void validate(InfoOptions o) {
		List<String> errors = new ArrayList<>();
		checkGrammarFile(o.getGrammarFile(), errors);
		throwIfAny(errors);
	}

	private static void checkGrammarFile(Path grammarFile, List<String> errors) {
		if (grammarFile == null) {
			errors.add("Grammar file is required.");
		} else if (!Files.isRegularFile(grammarFile)) {
			errors.add("Grammar file not found: " + grammarFile);
		}
	}

	private static void checkMaxRecursion(int maxRecursion, List<String> errors) {
		if (maxRecursion < 1 || maxRecursion > GeneratorConfig.MAX_RECURSION_DEPTH_LIMIT) {
			errors.add("Maximum recursion depth must be between 1 and " + GeneratorConfig.MAX_RECURSION_DEPTH_LIMIT
					+ " (--max-recursion / -d). Got: " + maxRecursion);
		}
	}

	private static void checkOutput(Path output, List<String> errors) {
		if (output == null) {
			return;
		}
		Path parent = output.toAbsolutePath().normalize().getParent();
		if (parent != null && !Files.isDirectory(parent)) {
			errors.add("Output directory does not exist: " + parent);
		}
		if (Files.isDirectory(output)) {
			errors.add("Output path is a directory: " + output);
		}
	}

	private static void throwIfAny(List<String> errors) {
		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
	}
}
