package com.jsgf.tools.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A reference to another rule by its bare name. Resolved only at generation time.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class NonTerminalNode extends GrammarNode {
    @NonNull String name;

    @Override
    public <R, C> R accept(GrammarNodeVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }

    @Override
    public String toString() {
        return "<" + name + ">";
    }
}
