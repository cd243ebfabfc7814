package com.jsgf.tools.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A literal token.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class TerminalNode extends GrammarNode {
    @NonNull String text;

    @Override
    public <R, C> R accept(GrammarNodeVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }

    @Override
    public String toString() {
        return text;
    }
}
