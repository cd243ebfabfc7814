package com.jsgf.tools.generator;

import com.jsgf.tools.exception.RecursionLimitException;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-rule depth counters for one derivation.
 *
 * A new guard is created for every top-level derivation and passed down the
 * traversal, so counters never outlive the call that owns them.
 */
public class RecursionGuard {

    private final int maxDepth;
    private final Map<String, Integer> depths = new HashMap<>();

    public RecursionGuard(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * @throws RecursionLimitException if the rule is now open more than {@code maxDepth} times
     */
    public void enter(String ruleName) {
        int depth = depths.merge(ruleName, 1, Integer::sum);
        if (depth > maxDepth) {
            throw new RecursionLimitException(ruleName, maxDepth);
        }
    }

    public void exit(String ruleName) {
        depths.computeIfPresent(ruleName, (name, depth) -> depth > 1 ? depth - 1 : null);
    }

    public int depth(String ruleName) {
        return depths.getOrDefault(ruleName, 0);
    }
}
