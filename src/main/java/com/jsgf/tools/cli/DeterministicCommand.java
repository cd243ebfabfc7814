package com.jsgf.tools.cli;

import java.io.IOException;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsgf.tools.cli.model.DeterministicOptions;
import com.jsgf.tools.generator.DeterministicGenerator;
import com.jsgf.tools.generator.GeneratorConfig;
import com.jsgf.tools.model.Grammar;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Prints every string a non-recursive grammar can produce.
 */
@Command(
        name = "deterministic",
        mixinStandardHelpOptions = true,
        description = "Generate all possible strings from a non-recursive JSGF grammar."
)
public class DeterministicCommand extends AbstractGrammarCommand {

    private static final Logger log = LoggerFactory.getLogger(DeterministicCommand.class);

    @Mixin
    private DeterministicOptions options = new DeterministicOptions();

    @Override
    protected void execute() throws IOException {
        validator.validate(options);

        Grammar grammar = loader.load(options.getGrammarFile());

        if (options.getRule() == null && grammar.isRecursive()) {
            printer.printRecursionWarning();
        }

        GeneratorConfig config = GeneratorConfig.builder()
                .maxRecursionDepth(options.getMaxRecursion())
                .maxResults(options.getMaxResults())
                .build();
        DeterministicGenerator generator = new DeterministicGenerator(grammar, config);

        Stream<String> strings = generator.generate(options.getRule());
        if (options.getMaxResults() != null) {
            strings = strings.limit(options.getMaxResults());
        }
        int written = printer.writeStrings(strings, options.getOutput());
        log.debug("Deterministic generation produced {} strings", written);
    }
}
