package com.jsgf.tools.cli.exception;

import java.util.List;

import com.jsgf.tools.exception.JsgfException;

/**
 * Rejected command line options. Carries every problem found, in the order checked.
 */
public class OptionsValidationException extends JsgfException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super("Invalid options: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
