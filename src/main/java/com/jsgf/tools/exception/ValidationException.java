package com.jsgf.tools.exception;

import java.util.List;
import java.util.Map;

/**
 * Holds every problem found by a single grammar validation pass.
 */
public class ValidationException extends JsgfException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;
    private final Map<String, List<String>> undefinedReferences;

    public ValidationException(List<String> errors, Map<String, List<String>> undefinedReferences) {
        super("Grammar validation failed:" + System.lineSeparator()
                + String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
        this.undefinedReferences = Map.copyOf(undefinedReferences);
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * Undefined rule names keyed by the rule that references them.
     */
    public Map<String, List<String>> getUndefinedReferences() {
        return undefinedReferences;
    }
}
