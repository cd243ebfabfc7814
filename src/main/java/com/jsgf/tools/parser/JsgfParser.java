package com.jsgf.tools.parser;

import com.jsgf.tools.exception.DuplicateRuleException;
import com.jsgf.tools.exception.ParseException;
import com.jsgf.tools.model.Grammar;
import com.jsgf.tools.model.Rule;
import com.jsgf.tools.parser.JsgfToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;

/**
 * Parses grammar source text into a {@link Grammar}.
 *
 * Source is read line by line into a buffer. After every line the buffer is scanned
 * for complete rule definitions (everything up to a ';'), each of which is parsed and
 * added to the grammar before the buffer advances past it. Rules may therefore span
 * several lines while errors still point at the line where a rule began.
 *
 * The parser does not open files; callers supply a {@link Reader}.
 */
public class JsgfParser {
    private static final Logger log = LoggerFactory.getLogger(JsgfParser.class);

    /**
     * Parse and validate a grammar.
     *
     * @throws ParseException                                    if the source is malformed
     * @throws com.jsgf.tools.exception.ValidationException if references are undefined or no rule is public
     */
    public Grammar parse(Reader reader) {
        Grammar grammar = parseUnvalidated(reader);
        grammar.validate();
        return grammar;
    }

    public Grammar parse(String source) {
        return parse(new StringReader(source));
    }

    /**
     * Parse a grammar without checking references or public rules.
     */
    public Grammar parseUnvalidated(Reader reader) {
        RuleScanner scanner = new RuleScanner();
        BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        String line;
        try {
            while ((line = lines.readLine()) != null) {
                scanner.accept(line);
            }
        } catch (IOException e) {
            throw new ParseException("Failed to read grammar source: " + e.getMessage(), scanner.lineNumber, 0, e);
        }
        scanner.finish();

        log.info("Parsed grammar: {} rules ({} public)", scanner.grammar.size(),
                scanner.grammar.getPublicRules().size());
        return scanner.grammar;
    }

    public Grammar parseUnvalidated(String source) {
        return parseUnvalidated(new StringReader(source));
    }

    /**
     * Per-parse state: the grammar built so far and the pending source text.
     */
    private static final class RuleScanner {
        private final Grammar grammar = new Grammar();
        private final CommentStripper commentStripper = new CommentStripper();
        private final StringBuilder buffer = new StringBuilder();
        private int bufferLine = 1;
        private int bufferColumn = 1;
        private int lineNumber = 0;

        void accept(String line) {
            lineNumber++;
            if (buffer.toString().isBlank()) {
                buffer.setLength(0);
                bufferLine = lineNumber;
                bufferColumn = 1;
            }
            buffer.append(commentStripper.strip(line)).append('\n');
            extractRules();
        }

        void finish() {
            if (commentStripper.isInBlockComment()) {
                throw new ParseException("Unterminated block comment", lineNumber);
            }
            if (buffer.toString().isBlank()) {
                return;
            }
            JsgfToken first = tokenizeBuffer().get(0);
            throw new ParseException("Incomplete rule definition, missing ';'", first.getLine(), first.getColumn());
        }

        private void extractRules() {
            while (true) {
                List<JsgfToken> tokens = tokenizeBuffer();
                int end = indexOfSemicolon(tokens);
                if (end < 0) {
                    return;
                }

                JsgfToken first = tokens.get(0);
                Rule rule = new JsgfRuleParser(tokens.subList(0, end + 1)).parseRule();
                try {
                    grammar.addRule(rule);
                } catch (DuplicateRuleException e) {
                    throw new ParseException(e.getMessage(), first.getLine(), first.getColumn(), e);
                }
                log.debug("Parsed rule {} at line {}", rule.getName(), first.getLine());

                JsgfToken semicolon = tokens.get(end);
                buffer.delete(0, semicolon.getEndOffset());
                bufferLine = semicolon.getLine();
                bufferColumn = semicolon.getColumn() + 1;
            }
        }

        private List<JsgfToken> tokenizeBuffer() {
            return new JsgfTokenizer(buffer.toString(), bufferLine, bufferColumn).tokenize();
        }

        private static int indexOfSemicolon(List<JsgfToken> tokens) {
            for (int i = 0; i < tokens.size(); i++) {
                if (tokens.get(i).getType() == TokenType.SEMICOLON) {
                    return i;
                }
            }
            return -1;
        }
    }
}
