package com.jsgf.tools.generator;

import com.jsgf.tools.exception.RecursionLimitException;
import com.jsgf.tools.model.AlternativeNode;
import com.jsgf.tools.model.Choice;
import com.jsgf.tools.model.Grammar;
import com.jsgf.tools.model.GrammarNode;
import com.jsgf.tools.model.GrammarNodeVisitor;
import com.jsgf.tools.model.GroupNode;
import com.jsgf.tools.model.NonTerminalNode;
import com.jsgf.tools.model.OptionalNode;
import com.jsgf.tools.model.Rule;
import com.jsgf.tools.model.SequenceNode;
import com.jsgf.tools.model.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Enumerates every string a rule can produce. Weights are ignored.
 *
 * Output order follows the source: sequence elements vary left-most slowest and
 * alternatives contribute in choice order. The grammar is expected to be acyclic; on a
 * cyclic grammar the recursion guard fails the derivation with a
 * {@link RecursionLimitException}, also when the call stack runs out first.
 */
public class DeterministicGenerator extends BaseGenerator {
    private static final Logger log = LoggerFactory.getLogger(DeterministicGenerator.class);

    private final Expander expander = new Expander();

    public DeterministicGenerator(Grammar grammar) {
        this(grammar, GeneratorConfig.defaults());
    }

    public DeterministicGenerator(Grammar grammar, GeneratorConfig config) {
        super(grammar, config);
    }

    @Override
    public Stream<String> generate(String ruleName) {
        if (ruleName != null) {
            return expandRule(requireRule(ruleName));
        }
        return grammar.getPublicRules().stream().flatMap(this::expandRule);
    }

    /**
     * All strings of one rule, each derived with a fresh recursion guard.
     */
    public List<String> expand(Rule rule) {
        log.debug("Enumerating rule {}", rule.getName());
        List<String> strings;
        try {
            strings = rule.getExpansion().accept(expander, newGuard());
        } catch (StackOverflowError e) {
            throw new RecursionLimitException(rule.getName(), config.getMaxRecursionDepth(), e);
        }
        log.debug("Rule {} produced {} strings", rule.getName(), strings.size());
        return strings;
    }

    private Stream<String> expandRule(Rule rule) {
        return Stream.of(rule).flatMap(r -> expand(r).stream()).map(String::strip);
    }

    static List<String> crossProduct(List<List<String>> elementStrings) {
        List<String> combined = List.of("");
        for (List<String> options : elementStrings) {
            List<String> next = new ArrayList<>(combined.size() * options.size());
            for (String prefix : combined) {
                for (String option : options) {
                    next.add(join(prefix, option));
                }
            }
            combined = next;
        }
        return combined;
    }

    private static String join(String left, String right) {
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        return left + " " + right;
    }

    private final class Expander implements GrammarNodeVisitor<List<String>, RecursionGuard> {

        @Override
        public List<String> visit(TerminalNode terminal, RecursionGuard guard) {
            return List.of(terminal.getText());
        }

        @Override
        public List<String> visit(NonTerminalNode nonTerminal, RecursionGuard guard) {
            Rule rule = resolveReference(nonTerminal.getName());
            guard.enter(rule.getName());
            try {
                return rule.getExpansion().accept(this, guard);
            } finally {
                guard.exit(rule.getName());
            }
        }

        @Override
        public List<String> visit(SequenceNode sequence, RecursionGuard guard) {
            List<List<String>> elementStrings = new ArrayList<>(sequence.getElements().size());
            for (GrammarNode element : sequence.getElements()) {
                elementStrings.add(element.accept(this, guard));
            }
            return crossProduct(elementStrings);
        }

        @Override
        public List<String> visit(AlternativeNode alternative, RecursionGuard guard) {
            List<String> strings = new ArrayList<>();
            for (Choice choice : alternative.getChoices()) {
                strings.addAll(choice.getNode().accept(this, guard));
            }
            return strings;
        }

        @Override
        public List<String> visit(OptionalNode optional, RecursionGuard guard) {
            List<String> inner = optional.getElement().accept(this, guard);
            List<String> strings = new ArrayList<>(inner.size() + 1);
            strings.add("");
            strings.addAll(inner);
            return strings;
        }

        @Override
        public List<String> visit(GroupNode group, RecursionGuard guard) {
            return group.getElement().accept(this, guard);
        }
    }
}
