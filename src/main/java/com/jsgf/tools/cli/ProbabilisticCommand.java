package com.jsgf.tools.cli;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsgf.tools.cli.model.ProbabilisticOptions;
import com.jsgf.tools.generator.GeneratorConfig;
import com.jsgf.tools.generator.ProbabilisticGenerator;
import com.jsgf.tools.model.Grammar;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Prints a fixed number of randomly sampled strings.
 */
@Command(
        name = "probabilistic",
        mixinStandardHelpOptions = true,
        description = "Generate random strings from a JSGF grammar, honouring alternative weights."
)
public class ProbabilisticCommand extends AbstractGrammarCommand {

    private static final Logger log = LoggerFactory.getLogger(ProbabilisticCommand.class);

    @Mixin
    private ProbabilisticOptions options = new ProbabilisticOptions();

    @Override
    protected void execute() throws IOException {
        validator.validate(options);

        Grammar grammar = loader.load(options.getGrammarFile());

        GeneratorConfig config = GeneratorConfig.builder()
                .maxRecursionDepth(options.getMaxRecursion())
                .randomSeed(options.getSeed())
                .build();
        ProbabilisticGenerator generator = new ProbabilisticGenerator(grammar, config);

        int written = printer.writeStrings(generator.generate(options.getRule()).limit(options.getCount()),
                options.getOutput());
        log.debug("Probabilistic generation produced {} strings", written);
    }
}
