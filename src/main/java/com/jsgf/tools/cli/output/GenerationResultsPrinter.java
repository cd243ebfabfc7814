package com.jsgf.tools.cli.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsgf.tools.exception.ValidationException;
import com.jsgf.tools.model.Grammar;
import com.jsgf.tools.model.Rule;

/**
 * Responsible only for CLI output: generated strings go to stdout or a file, reports go
 * to the log. No validation, no generation.
 */
public class GenerationResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerationResultsPrinter.class);

    private final PrintStream stdout;

    public GenerationResultsPrinter() {
        this(System.out);
    }

    public GenerationResultsPrinter(PrintStream stdout) {
        this.stdout = stdout;
    }

    /**
     * Write one string per line, pulling from the stream as it goes.
     *
     * @return number of lines written
     */
    public int writeStrings(Stream<String> strings, Path output) throws IOException {
        if (output == null) {
            PrintWriter writer = new PrintWriter(stdout, false, StandardCharsets.UTF_8);
            int count = write(strings, writer);
            writer.flush();
            return count;
        }
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            int count = write(strings, writer);
            log.info("Wrote {} strings to {}", count, output.toAbsolutePath());
            return count;
        }
    }

    private int write(Stream<String> strings, Writer writer) throws IOException {
        int count = 0;
        Iterator<String> iterator = strings.iterator();
        while (iterator.hasNext()) {
            writer.write(iterator.next());
            writer.write(System.lineSeparator());
            count++;
        }
        return count;
    }

    public void printRecursionWarning() {
        log.warn("Warning: Grammar contains recursive rules. Consider using probabilistic generation instead.");
    }

    public void printGrammarInfo(Path grammarFile, Grammar grammar, boolean verbose) {
        log.info("Grammar: {}", grammarFile);
        log.info("Total rules: {}", grammar.size());
        log.info("Public rules: {}", grammar.getPublicRules().size());

        if (verbose) {
            log.info("");
            log.info("Public rules:");
            for (Rule rule : grammar.getPublicRules()) {
                log.info("  - {}", rule.getName());
            }

            log.info("");
            log.info("All rules:");
            grammar.getRuleNames().stream().sorted().forEach(name -> {
                Rule rule = grammar.getRule(name).orElseThrow();
                log.info("  - {} ({})", name, rule.isPublic() ? "public" : "private");
            });
        }

        log.info("");
        List<List<String>> cycles = grammar.detectCycles();
        if (cycles.isEmpty()) {
            log.info("Recursive: No");
        } else {
            log.info("Recursive: Yes ({} cycle(s))", cycles.size());
            if (verbose) {
                for (int i = 0; i < cycles.size(); i++) {
                    log.info("  Cycle {}: {}", i + 1, String.join(" -> ", cycles.get(i)));
                }
            }
        }
    }

    public void printValidationResult(ValidationException failure) {
        if (failure == null) {
            log.info("Validation: Passed");
            return;
        }
        log.info("Validation: Failed");
        failure.getErrors().forEach(error -> log.info("  {}", error));
    }
}
