package com.jsgf.tools.model;

/**
 * Base class for all grammar expression nodes.
 *
 * The set of node kinds is closed: the constructor is package-private, so the
 * only subclasses are the ones declared in this package. Behaviour over nodes
 * lives in {@link GrammarNodeVisitor} implementations.
 */
public abstract class GrammarNode {

    GrammarNode() {
    }

    public abstract <R, C> R accept(GrammarNodeVisitor<R, C> visitor, C context);
}
