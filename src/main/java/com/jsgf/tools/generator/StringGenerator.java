package com.jsgf.tools.generator;

import java.util.List;
import java.util.stream.Stream;

/**
 * Produces strings from a grammar.
 */
public interface StringGenerator {

    /**
     * Strings derived from the named rule, or from the public rules when {@code ruleName}
     * is {@code null}. The stream is lazy; consumers may stop at any point.
     */
    Stream<String> generate(String ruleName);

    default Stream<String> generate() {
        return generate(null);
    }

    /**
     * At most {@code limit} strings (unbounded when {@code null}), also capped by the
     * configured maximum result count.
     */
    List<String> generateList(String ruleName, Integer limit);
}
