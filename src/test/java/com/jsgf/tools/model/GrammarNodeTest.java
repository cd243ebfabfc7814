package com.jsgf.tools.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the expression node types.
 */
class GrammarNodeTest {

    @Test
    void testStructuralEquality() {
        GrammarNode first = SequenceNode.of(new TerminalNode("a"), new OptionalNode(new NonTerminalNode("b")));
        GrammarNode second = SequenceNode.of(new TerminalNode("a"), new OptionalNode(new NonTerminalNode("b")));

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(new GroupNode(new TerminalNode("a"))).isNotEqualTo(new OptionalNode(new TerminalNode("a")));
        assertThat(Choice.weighted(new TerminalNode("a"), 2.0)).isNotEqualTo(Choice.of(new TerminalNode("a")));
    }

    @Test
    void testUnweightedChoicesDefaultToWeightOne() {
        AlternativeNode alternative = AlternativeNode.unweighted(new TerminalNode("hello"), new TerminalNode("hi"));

        assertThat(alternative.getWeights()).containsExactly(1.0, 1.0);
        assertThat(alternative.getTotalWeight()).isEqualTo(2.0);
        assertThat(alternative.getNodes()).containsExactly(new TerminalNode("hello"), new TerminalNode("hi"));
    }

    @Test
    void testSequenceCopiesItsElements() {
        List<GrammarNode> elements = new ArrayList<>(List.of(new TerminalNode("a")));
        SequenceNode sequence = new SequenceNode(elements);
        elements.add(new TerminalNode("b"));

        assertThat(sequence.getElements()).containsExactly(new TerminalNode("a"));
        assertThat(new SequenceNode(List.of()).isEmpty()).isTrue();
    }

    @Test
    void testSingleChoiceKeepsItsWeightWhenPrinted() {
        assertThat(AlternativeNode.of(Choice.of(new TerminalNode("x"))).toString()).isEqualTo("( /1.0/ x )");
        assertThat(AlternativeNode.of(Choice.weighted(new TerminalNode("x"), 2.5)).toString())
                .isEqualTo("( /2.5/ x )");
    }

    @Test
    void testToString() {
        assertThat(new NonTerminalNode("name").toString()).isEqualTo("<name>");
        assertThat(new OptionalNode(new TerminalNode("please")).toString()).isEqualTo("[ please ]");
        assertThat(new GroupNode(SequenceNode.of(new TerminalNode("a"), new TerminalNode("b"))).toString())
                .isEqualTo("( a b )");
        assertThat(AlternativeNode.of(Choice.weighted(new TerminalNode("hello"), 5.0), Choice.of(new TerminalNode("hi")))
                .toString()).isEqualTo("( /5.0/ hello | hi )");
    }
}
