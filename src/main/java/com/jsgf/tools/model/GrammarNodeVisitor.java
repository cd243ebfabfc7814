package com.jsgf.tools.model;

/**
 * Visitor over grammar expression nodes.
 *
 * @param <R> result produced for each node
 * @param <C> context threaded through a traversal
 */
public interface GrammarNodeVisitor<R, C> {
    R visit(TerminalNode terminal, C context);
    R visit(NonTerminalNode nonTerminal, C context);
    R visit(SequenceNode sequence, C context);
    R visit(AlternativeNode alternative, C context);
    R visit(OptionalNode optional, C context);
    R visit(GroupNode group, C context);
}
