package com.jsgf.tools.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One branch of an {@link AlternativeNode} together with its weight.
 */
@Value
public class Choice {
    public static final double DEFAULT_WEIGHT = 1.0;

    @NonNull GrammarNode node;
    double weight;

    public static Choice of(GrammarNode node) {
        return new Choice(node, DEFAULT_WEIGHT);
    }

    public static Choice weighted(GrammarNode node, double weight) {
        return new Choice(node, weight);
    }

    public boolean isWeighted() {
        return weight != DEFAULT_WEIGHT;
    }

    @Override
    public String toString() {
        return isWeighted() ? "/" + weight + "/ " + node : node.toString();
    }
}
