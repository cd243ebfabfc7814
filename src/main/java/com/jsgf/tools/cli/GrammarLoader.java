package com.jsgf.tools.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsgf.tools.model.Grammar;
import com.jsgf.tools.parser.JsgfParser;

/**
 * Opens grammar files for the commands; the parser itself only sees a reader.
 */
public class GrammarLoader {
    private static final Logger log = LoggerFactory.getLogger(GrammarLoader.class);

    private final JsgfParser parser = new JsgfParser();

    public Grammar load(Path grammarFile) throws IOException {
        log.debug("Loading grammar: {}", grammarFile);
        try (BufferedReader reader = Files.newBufferedReader(grammarFile, StandardCharsets.UTF_8)) {
            return parser.parse(reader);
        }
    }

    /**
     * Load without validation, so that validation problems can be reported separately.
     */
    public Grammar loadUnvalidated(Path grammarFile) throws IOException {
        log.debug("Loading grammar without validation: {}", grammarFile);
        try (BufferedReader reader = Files.newBufferedReader(grammarFile, StandardCharsets.UTF_8)) {
            return parser.parseUnvalidated(reader);
        }
    }
}
