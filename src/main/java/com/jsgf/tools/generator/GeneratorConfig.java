package com.jsgf.tools.generator;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the string generators.
 */
@Data
@Builder
public class GeneratorConfig {

    public static final int DEFAULT_MAX_RECURSION_DEPTH = 50;

    /** Largest depth the command line accepts. */
    public static final int MAX_RECURSION_DEPTH_LIMIT = 1000;

    /**
     * How many times one rule may be open at once within a single derivation.
     */
    @Builder.Default
    private int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;

    /**
     * Upper bound on strings returned by {@code generateList}; {@code null} means unbounded.
     */
    private Integer maxResults;

    /**
     * Seed for the probabilistic generator; {@code null} means unseeded.
     */
    private Long randomSeed;

    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }
}
