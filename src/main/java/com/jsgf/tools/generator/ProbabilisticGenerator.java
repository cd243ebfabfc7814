package com.jsgf.tools.generator;

import com.jsgf.tools.exception.GenerationException;
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

import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.StringJoiner;
import java.util.stream.Stream;

/**
 * Samples random strings from a grammar.
 *
 * Alternatives are chosen in proportion to their weights and every optional element is
 * included with probability {@value #OPTIONAL_INCLUSION_PROBABILITY}. Recursive grammars
 * are supported; the recursion guard bounds each individual derivation.
 */
public class ProbabilisticGenerator extends BaseGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProbabilisticGenerator.class);

    public static final double OPTIONAL_INCLUSION_PROBABILITY = 0.5;

    private final Random random;
    private final Sampler sampler = new Sampler();

    public ProbabilisticGenerator(Grammar grammar) {
        this(grammar, GeneratorConfig.defaults());
    }

    public ProbabilisticGenerator(Grammar grammar, GeneratorConfig config) {
        super(grammar, config);
        this.random = this.config.getRandomSeed() != null ? new Random(this.config.getRandomSeed()) : new Random();
    }

    ProbabilisticGenerator(Grammar grammar, GeneratorConfig config, Random random) {
        super(grammar, config);
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * An infinite stream; each element is one independent derivation computed on demand.
     */
    @Override
    public Stream<String> generate(String ruleName) {
        GrammarNode start = startNode(ruleName);
        String label = startLabel(ruleName);
        return Stream.generate(() -> derive(start, label));
    }

    public String generateOne(String ruleName) {
        return derive(startNode(ruleName), startLabel(ruleName));
    }

    @Override
    public List<String> generateList(String ruleName, Integer limit) {
        if (limit == null && config.getMaxResults() == null) {
            throw new IllegalArgumentException("Probabilistic generation needs a limit or a configured maximum result count");
        }
        return super.generateList(ruleName, limit);
    }

    private GrammarNode startNode(String ruleName) {
        if (ruleName != null) {
            return requireRule(ruleName).getExpansion();
        }

        List<Rule> publicRules = grammar.getPublicRules();
        if (publicRules.isEmpty()) {
            throw new GenerationException("No public rules available");
        }
        if (publicRules.size() == 1) {
            return publicRules.get(0).getExpansion();
        }
        log.debug("Sampling uniformly across {} public rules", publicRules.size());
        return new AlternativeNode(publicRules.stream().map(rule -> Choice.of(rule.getExpansion())).toList());
    }

    private String startLabel(String ruleName) {
        if (ruleName != null) {
            return requireRule(ruleName).getName();
        }
        return String.join("|", grammar.getPublicRuleNames());
    }

    private String derive(GrammarNode start, String label) {
        try {
            return start.accept(sampler, newGuard()).strip();
        } catch (StackOverflowError e) {
            throw new RecursionLimitException(label, config.getMaxRecursionDepth(), e);
        }
    }

    /**
     * Index of the first choice whose cumulative weight is at least {@code draw}, where
     * {@code draw} lies in {@code [0, total)}. Falls back to the last choice if rounding
     * pushes the draw past the final cumulative weight.
     */
    static int selectIndex(List<Choice> choices, double draw) {
        double cumulative = 0.0;
        for (int i = 0; i < choices.size(); i++) {
            cumulative += choices.get(i).getWeight();
            if (cumulative >= draw) {
                return i;
            }
        }
        return choices.size() - 1;
    }

    private final class Sampler implements GrammarNodeVisitor<String, RecursionGuard> {

        @Override
        public String visit(TerminalNode terminal, RecursionGuard guard) {
            return terminal.getText();
        }

        @Override
        public String visit(NonTerminalNode nonTerminal, RecursionGuard guard) {
            Rule rule = resolveReference(nonTerminal.getName());
            guard.enter(rule.getName());
            try {
                return rule.getExpansion().accept(this, guard);
            } finally {
                guard.exit(rule.getName());
            }
        }

        @Override
        public String visit(SequenceNode sequence, RecursionGuard guard) {
            StringJoiner joiner = new StringJoiner(" ");
            for (GrammarNode element : sequence.getElements()) {
                String piece = element.accept(this, guard);
                if (!piece.isEmpty()) {
                    joiner.add(piece);
                }
            }
            return joiner.toString();
        }

        @Override
        public String visit(AlternativeNode alternative, RecursionGuard guard) {
            List<Choice> choices = alternative.getChoices();
            if (choices.isEmpty()) {
                return "";
            }
            double draw = random.nextDouble() * alternative.getTotalWeight();
            return choices.get(selectIndex(choices, draw)).getNode().accept(this, guard);
        }

        @Override
        public String visit(OptionalNode optional, RecursionGuard guard) {
            if (random.nextDouble() < OPTIONAL_INCLUSION_PROBABILITY) {
                return optional.getElement().accept(this, guard);
            }
            return "";
        }

        @Override
        public String visit(GroupNode group, RecursionGuard guard) {
            return group.getElement().accept(this, guard);
        }
    }
}
