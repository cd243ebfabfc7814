package com.jsgf.tools.exception;

/**
 * Thrown when a string cannot be derived from a grammar.
 */
public class GenerationException extends JsgfException {

    private static final long serialVersionUID = 1L;

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
