package com.jsgf.tools.model;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Concatenation of elements. An empty sequence denotes the empty string.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class SequenceNode extends GrammarNode {
    List<GrammarNode> elements;

    public SequenceNode(List<GrammarNode> elements) {
        this.elements = List.copyOf(elements);
    }

    public static SequenceNode of(GrammarNode... elements) {
        return new SequenceNode(List.of(elements));
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public <R, C> R accept(GrammarNodeVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }

    @Override
    public String toString() {
        return elements.stream()
                .map(GrammarNode::toString)
                .collect(Collectors.joining(" "));
    }
}
