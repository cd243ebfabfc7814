package com.jsgf.tools.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsgf.tools.cli.exception.OptionsValidationException;
import com.jsgf.tools.cli.output.GenerationResultsPrinter;
import com.jsgf.tools.cli.validation.OptionsValidator;
import com.jsgf.tools.exception.JsgfException;

/**
 * Shared error handling for the grammar commands: every failure is logged and turned
 * into exit code 1.
 */
public abstract class AbstractGrammarCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractGrammarCommand.class);

    protected final OptionsValidator validator = new OptionsValidator();
    protected final GrammarLoader loader = new GrammarLoader();
    protected GenerationResultsPrinter printer = new GenerationResultsPrinter();

    @Override
    public Integer call() {
        try {
            execute();
            return 0;
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("Error: {}", error));
            return 1;
        } catch (JsgfException e) {
            log.error("Error: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Error: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Unexpected error", e);
            return 1;
        }
    }

    protected abstract void execute() throws IOException;

    void setPrinter(GenerationResultsPrinter printer) {
        this.printer = printer;
    }
}
