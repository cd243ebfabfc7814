package com.jsgf.tools.model;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Disjunction over weighted choices. Choice order is source order.
 *
 * A single choice always prints its weight; without it the text would read back as a
 * plain group.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class AlternativeNode extends GrammarNode {
    List<Choice> choices;

    public AlternativeNode(List<Choice> choices) {
        this.choices = List.copyOf(choices);
    }

    /**
     * Builds an alternative where every choice carries the default weight.
     */
    public static AlternativeNode unweighted(GrammarNode... nodes) {
        return new AlternativeNode(Arrays.stream(nodes).map(Choice::of).toList());
    }

    public static AlternativeNode of(Choice... choices) {
        return new AlternativeNode(List.of(choices));
    }

    public List<GrammarNode> getNodes() {
        return choices.stream().map(Choice::getNode).toList();
    }

    public List<Double> getWeights() {
        return choices.stream().map(Choice::getWeight).toList();
    }

    public double getTotalWeight() {
        return choices.stream().mapToDouble(Choice::getWeight).sum();
    }

    @Override
    public <R, C> R accept(GrammarNodeVisitor<R, C> visitor, C context) {
        return visitor.visit(this, context);
    }

    @Override
    public String toString() {
        if (choices.size() == 1) {
            Choice only = choices.get(0);
            return "( /" + only.getWeight() + "/ " + only.getNode() + " )";
        }
        return choices.stream()
                .map(Choice::toString)
                .collect(Collectors.joining(" | ", "( ", " )"));
    }
}
