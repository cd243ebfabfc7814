package com.jsgf.tools.exception;

/**
 * Thrown when a derivation enters the same rule more often than the configured depth allows.
 */
public class RecursionLimitException extends GenerationException {

    private static final long serialVersionUID = 1L;
    private final String ruleName;
    private final int maxDepth;

    public RecursionLimitException(String ruleName, int maxDepth) {
        super("Maximum recursion depth (" + maxDepth + ") exceeded for rule '" + ruleName + "'");
        this.ruleName = ruleName;
        this.maxDepth = maxDepth;
    }

    /**
     * The call stack ran out before the configured depth was reached.
     */
    public RecursionLimitException(String ruleName, int maxDepth, StackOverflowError cause) {
        super("Call stack exhausted before maximum recursion depth (" + maxDepth + ") was reached for rule '"
                + ruleName + "'", cause);
        this.ruleName = ruleName;
        this.maxDepth = maxDepth;
    }

    public String getRuleName() {
        return ruleName;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
