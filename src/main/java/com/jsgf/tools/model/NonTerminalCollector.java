package com.jsgf.tools.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the names of every rule referenced directly by an expression, in source order.
 */
final class NonTerminalCollector implements GrammarNodeVisitor<Void, List<String>> {

    private static final NonTerminalCollector INSTANCE = new NonTerminalCollector();

    static List<String> collect(GrammarNode node) {
        List<String> names = new ArrayList<>();
        node.accept(INSTANCE, names);
        return names;
    }

    @Override
    public Void visit(TerminalNode terminal, List<String> names) {
        return null;
    }

    @Override
    public Void visit(NonTerminalNode nonTerminal, List<String> names) {
        names.add(nonTerminal.getName());
        return null;
    }

    @Override
    public Void visit(SequenceNode sequence, List<String> names) {
        for (GrammarNode element : sequence.getElements()) {
            element.accept(this, names);
        }
        return null;
    }

    @Override
    public Void visit(AlternativeNode alternative, List<String> names) {
        for (Choice choice : alternative.getChoices()) {
            choice.getNode().accept(this, names);
        }
        return null;
    }

    @Override
    public Void visit(OptionalNode optional, List<String> names) {
        return optional.getElement().accept(this, names);
    }

    @Override
    public Void visit(GroupNode group, List<String> names) {
        return group.getElement().accept(this, names);
    }
}
