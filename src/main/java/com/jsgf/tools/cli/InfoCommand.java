package com.jsgf.tools.cli;

import java.io.IOException;

import com.jsgf.tools.cli.model.InfoOptions;
import com.jsgf.tools.exception.ValidationException;
import com.jsgf.tools.model.Grammar;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Reports rule counts, recursion and validation status of a grammar.
 */
@Command(
        name = "info",
        mixinStandardHelpOptions = true,
        description = "Display information about a JSGF grammar."
)
public class InfoCommand extends AbstractGrammarCommand {

    @Mixin
    private InfoOptions options = new InfoOptions();

    @Override
    protected void execute() throws IOException {
        validator.validate(options);

        Grammar grammar = loader.loadUnvalidated(options.getGrammarFile());
        printer.printGrammarInfo(options.getGrammarFile(), grammar, options.isVerbose());

        ValidationException failure = null;
        try {
            grammar.validate();
        } catch (ValidationException e) {
            failure = e;
        }
        printer.printValidationResult(failure);
    }
}
