package com.jsgf.tools.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A named rule definition. The name is the bare identifier without angle brackets.
 */
@Value
public class Rule {
    @NonNull String name;
    @NonNull GrammarNode expansion;
    boolean isPublic;

    public static Rule publicRule(String name, GrammarNode expansion) {
        return new Rule(name, expansion, true);
    }

    public static Rule privateRule(String name, GrammarNode expansion) {
        return new Rule(name, expansion, false);
    }

    @Override
    public String toString() {
        return (isPublic ? "public " : "") + "<" + name + "> = " + expansion + ";";
    }
}
