package com.jsgf.tools.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * An element that may be present or absent.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class OptionalNode extends GrammarNode {
    @NonNull GrammarNode element;

    @Override
    public <R, C> R accept(GrammarNodeVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }

    @Override
    public String toString() {
        return "[ " + element + " ]";
    }
}
