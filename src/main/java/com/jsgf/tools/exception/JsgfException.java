package com.jsgf.tools.exception;

/**
 * Base exception for all grammar parsing, validation and generation failures.
 */
public class JsgfException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public JsgfException(String message) {
        super(message);
    }

    public JsgfException(String message, Throwable cause) {
        super(message, cause);
    }
}
