package com.jsgf.tools.exception;

public class DuplicateRuleException extends JsgfException {

    private static final long serialVersionUID = 1L;
    private final String ruleName;

    public DuplicateRuleException(String ruleName) {
        super("Rule '" + ruleName + "' already exists");
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }
}
