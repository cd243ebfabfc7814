package com.jsgf.tools.model;

import com.jsgf.tools.exception.DuplicateRuleException;
import com.jsgf.tools.exception.ValidationException;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A set of uniquely named rules, some of which are public entry points.
 *
 * Rules are added while the grammar is being built; afterwards the grammar is only
 * read. All accessors return unmodifiable views.
 */
@EqualsAndHashCode
public class Grammar {

    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private final List<Rule> publicRules = new ArrayList<>();

    /**
     * Add a rule, also registering it as an entry point if it is public.
     *
     * @throws DuplicateRuleException if a rule with the same name exists
     */
    public void addRule(Rule rule) {
        Objects.requireNonNull(rule, "rule");
        if (rules.containsKey(rule.getName())) {
            throw new DuplicateRuleException(rule.getName());
        }
        rules.put(rule.getName(), rule);
        if (rule.isPublic()) {
            publicRules.add(rule);
        }
    }

    /**
     * Look up a rule by name; {@code <name>} and {@code name} are equivalent.
     */
    public Optional<Rule> getRule(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get(bareName(name)));
    }

    public boolean hasRule(String name) {
        return getRule(name).isPresent();
    }

    public Map<String, Rule> getRules() {
        return Collections.unmodifiableMap(rules);
    }

    public List<Rule> getPublicRules() {
        return Collections.unmodifiableList(publicRules);
    }

    public List<String> getRuleNames() {
        return List.copyOf(rules.keySet());
    }

    public List<String> getPublicRuleNames() {
        return publicRules.stream().map(Rule::getName).toList();
    }

    public int size() {
        return rules.size();
    }

    /**
     * Rule name to the names it references directly, in source order.
     */
    public Map<String, List<String>> dependencyGraph() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (Rule rule : rules.values()) {
            graph.put(rule.getName(), NonTerminalCollector.collect(rule.getExpansion()));
        }
        return graph;
    }

    /**
     * Rule name to the referenced names that have no rule. Rules without such references are omitted.
     */
    public Map<String, List<String>> findUndefinedReferences() {
        Map<String, List<String>> undefined = new LinkedHashMap<>();
        dependencyGraph().forEach((ruleName, references) -> {
            List<String> missing = references.stream()
                    .filter(reference -> !hasRule(reference))
                    .distinct()
                    .toList();
            if (!missing.isEmpty()) {
                undefined.put(ruleName, missing);
            }
        });
        return undefined;
    }

    /**
     * Check that every reference resolves and that there is at least one public rule.
     * Both checks always run so that one failure reports everything.
     *
     * @throws ValidationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        Map<String, List<String>> undefined = findUndefinedReferences();
        undefined.forEach((ruleName, missing) -> errors.add(
                "Rule '" + ruleName + "' references undefined non-terminals: " + String.join(", ", missing)));

        if (publicRules.isEmpty()) {
            errors.add("Grammar must have at least one public rule");
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors, undefined);
        }
    }

    /**
     * Find cycles in the rule dependency graph by depth-first search. Each cycle is the
     * path from the repeated rule back to itself, e.g. {@code [S, A, S]}.
     */
    public List<List<String>> detectCycles() {
        Map<String, List<String>> graph = dependencyGraph();
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();

        for (String ruleName : graph.keySet()) {
            if (!visited.contains(ruleName)) {
                findCycles(ruleName, new ArrayList<>(), graph, visited, onStack, cycles);
            }
        }
        return cycles;
    }

    private void findCycles(String node, List<String> path, Map<String, List<String>> graph,
                            Set<String> visited, Set<String> onStack, List<List<String>> cycles) {
        if (onStack.contains(node)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(node), path.size()));
            cycle.add(node);
            cycles.add(List.copyOf(cycle));
            return;
        }
        if (visited.contains(node)) {
            return;
        }

        visited.add(node);
        onStack.add(node);
        path.add(node);

        for (String neighbour : graph.getOrDefault(node, List.of())) {
            findCycles(neighbour, new ArrayList<>(path), graph, visited, onStack, cycles);
        }

        onStack.remove(node);
    }

    public boolean isRecursive() {
        return !detectCycles().isEmpty();
    }

    /**
     * Whether the named rule takes part in any detected cycle.
     */
    public boolean isRecursive(String ruleName) {
        if (ruleName == null) {
            return isRecursive();
        }
        String name = bareName(ruleName);
        return detectCycles().stream().anyMatch(cycle -> cycle.contains(name));
    }

    static String bareName(String name) {
        String result = name.strip();
        if (result.startsWith("<")) {
            result = result.substring(1);
        }
        if (result.endsWith(">")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    @Override
    public String toString() {
        return rules.values().stream()
                .map(Rule::toString)
                .collect(Collectors.joining("\n"));
    }
}
