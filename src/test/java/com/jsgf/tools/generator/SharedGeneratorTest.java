package com.jsgf.tools.generator;

import com.jsgf.tools.exception.RecursionLimitException;
import com.jsgf.tools.model.Grammar;
import com.jsgf.tools.parser.JsgfParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * One generator instance used from many threads at once, with failing and
 * succeeding derivations interleaved.
 */
class SharedGeneratorTest {

    private static final int TASKS = 400;
    private static final int THREADS = 8;

    private Grammar grammar;
    private GeneratorConfig config;

    @BeforeEach
    void setUp() {
        grammar = new JsgfParser().parse(String.join("\n",
                "public <loop> = <again>;",
                "<again> = x <loop>;",
                "public <triple> = <a> <a> <a>;",
                "<a> = p | q | r;"));
        config = GeneratorConfig.builder().maxRecursionDepth(3).randomSeed(9L).build();
    }

    private static <T> List<Future<T>> runAll(List<Callable<T>> tasks) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            return executor.invokeAll(tasks);
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void testDeterministicCallsDoNotInterfere() throws Exception {
        DeterministicGenerator generator = new DeterministicGenerator(grammar, config);
        List<Callable<List<String>>> tasks = new ArrayList<>();
        for (int i = 0; i < TASKS; i++) {
            String rule = i % 2 == 0 ? "loop" : "triple";
            tasks.add(() -> generator.generate(rule).toList());
        }

        List<Future<List<String>>> futures = runAll(tasks);

        for (int i = 0; i < TASKS; i++) {
            Future<List<String>> future = futures.get(i);
            if (i % 2 == 0) {
                assertThatThrownBy(future::get).hasCauseInstanceOf(RecursionLimitException.class);
            } else {
                List<String> strings = future.get();
                assertThat(strings).hasSize(27).doesNotHaveDuplicates();
                assertThat(strings.get(0)).isEqualTo("p p p");
                assertThat(strings.get(26)).isEqualTo("r r r");
            }
        }
    }

    @Test
    void testProbabilisticCallsDoNotInterfere() throws Exception {
        ProbabilisticGenerator generator = new ProbabilisticGenerator(grammar, config);
        List<Callable<String>> tasks = new ArrayList<>();
        for (int i = 0; i < TASKS; i++) {
            String rule = i % 2 == 0 ? "loop" : "triple";
            tasks.add(() -> generator.generateOne(rule));
        }

        List<Future<String>> futures = runAll(tasks);

        for (int i = 0; i < TASKS; i++) {
            Future<String> future = futures.get(i);
            if (i % 2 == 0) {
                assertThatThrownBy(future::get).hasCauseInstanceOf(RecursionLimitException.class);
            } else {
                assertThat(future.get()).matches("[pqr] [pqr] [pqr]");
            }
        }
    }
}
