package com.jsgf.tools.generator;

import com.jsgf.tools.exception.RecursionLimitException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RecursionGuard.
 */
class RecursionGuardTest {

    @Test
    void testEnterAndExitTrackDepthPerRule() {
        RecursionGuard guard = new RecursionGuard(3);

        guard.enter("a");
        guard.enter("a");
        guard.enter("b");

        assertThat(guard.depth("a")).isEqualTo(2);
        assertThat(guard.depth("b")).isEqualTo(1);

        guard.exit("a");
        guard.exit("b");

        assertThat(guard.depth("a")).isEqualTo(1);
        assertThat(guard.depth("b")).isZero();
    }

    @Test
    void testExceedingLimitThrows() {
        RecursionGuard guard = new RecursionGuard(2);
        guard.enter("list");
        guard.enter("list");

        assertThatThrownBy(() -> guard.enter("list"))
                .isInstanceOfSatisfying(RecursionLimitException.class, e -> {
                    assertThat(e.getRuleName()).isEqualTo("list");
                    assertThat(e.getMaxDepth()).isEqualTo(2);
                    assertThat(e.getMessage()).isEqualTo("Maximum recursion depth (2) exceeded for rule 'list'");
                });
    }

    @Test
    void testSequentialUsesDoNotAccumulate() {
        RecursionGuard guard = new RecursionGuard(1);

        for (int i = 0; i < 10; i++) {
            guard.enter("word");
            guard.exit("word");
        }

        assertThat(guard.depth("word")).isZero();
    }

    @Test
    void testExitOfUnknownRuleIsIgnored() {
        RecursionGuard guard = new RecursionGuard(1);

        guard.exit("never-entered");

        assertThat(guard.depth("never-entered")).isZero();
    }

    @Test
    void testLimitMustBePositive() {
        assertThatThrownBy(() -> new RecursionGuard(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
