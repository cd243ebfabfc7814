package com.jsgf.tools.generator;

import com.jsgf.tools.exception.GenerationException;
import com.jsgf.tools.model.Grammar;
import com.jsgf.tools.model.Rule;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Common rule lookup, result limiting and recursion guard creation for generators.
 * The grammar is only read.
 */
public abstract class BaseGenerator implements StringGenerator {

    protected final Grammar grammar;
    protected final GeneratorConfig config;

    protected BaseGenerator(Grammar grammar, GeneratorConfig config) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.config = config != null ? config : GeneratorConfig.defaults();
    }

    @Override
    public List<String> generateList(String ruleName, Integer limit) {
        Stream<String> strings = generate(ruleName);
        if (limit != null) {
            strings = strings.limit(Math.max(0, limit));
        }
        if (config.getMaxResults() != null) {
            strings = strings.limit(Math.max(0, config.getMaxResults()));
        }
        return strings.toList();
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public GeneratorConfig getConfig() {
        return config;
    }

    protected Rule requireRule(String ruleName) {
        return grammar.getRule(ruleName)
                .orElseThrow(() -> new GenerationException("Rule '" + ruleName + "' not found"));
    }

    protected Rule resolveReference(String ruleName) {
        return grammar.getRule(ruleName)
                .orElseThrow(() -> new GenerationException("Undefined rule: " + ruleName));
    }

    protected RecursionGuard newGuard() {
        return new RecursionGuard(config.getMaxRecursionDepth());
    }
}
