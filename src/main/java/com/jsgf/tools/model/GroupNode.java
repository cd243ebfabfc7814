package com.jsgf.tools.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * Parenthesised element. Only affects parsing; generation treats it as its element.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class GroupNode extends GrammarNode {
    @NonNull GrammarNode element;

    @Override
    public <R, C> R accept(GrammarNodeVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }

    @Override
    public String toString() {
        return "( " + element + " )";
    }
}
