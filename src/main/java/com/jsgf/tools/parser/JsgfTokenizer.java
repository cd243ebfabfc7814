package com.jsgf.tools.parser;

import com.jsgf.tools.exception.ParseException;
import com.jsgf.tools.parser.JsgfToken.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for comment-free grammar source text.
 *
 * The text may start anywhere in the original source; {@code startLine} and
 * {@code startColumn} give the source position of its first character.
 */
public class JsgfTokenizer {

    private static final String WORD_PUNCTUATION = "'_-";
    private static final String RULE_NAME_PUNCTUATION = "$_:;,=|/\\()[]@#%!^&~-.";

    private final String source;
    private int pos = 0;
    private int line;
    private int column;

    public JsgfTokenizer(String source) {
        this(source, 1, 1);
    }

    public JsgfTokenizer(String source, int startLine, int startColumn) {
        this.source = source;
        this.line = startLine;
        this.column = startColumn;
    }

    /**
     * Tokenize the entire text. The last token is always {@link TokenType#EOF}.
     *
     * @throws ParseException on a character that cannot start a token, or an unterminated
     *                        rule reference or weight
     */
    public List<JsgfToken> tokenize() {
        List<JsgfToken> tokens = new ArrayList<>();

        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new JsgfToken(TokenType.EOF, "", line, column, pos));
        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                line++;
                column = 1;
                pos++;
            } else if (Character.isWhitespace(c)) {
                column++;
                pos++;
            } else {
                break;
            }
        }
    }

    private JsgfToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        switch (c) {
            case '=':
                return single(TokenType.EQUALS, startLine, startCol);
            case '|':
                return single(TokenType.PIPE, startLine, startCol);
            case ';':
                return single(TokenType.SEMICOLON, startLine, startCol);
            case '(':
                return single(TokenType.LPAREN, startLine, startCol);
            case ')':
                return single(TokenType.RPAREN, startLine, startCol);
            case '[':
                return single(TokenType.LBRACKET, startLine, startCol);
            case ']':
                return single(TokenType.RBRACKET, startLine, startCol);
            case '<':
                return readRuleReference(startLine, startCol);
            case '/':
                return readWeight(startLine, startCol);
            default:
                break;
        }

        if (isWordChar(c)) {
            return readWord(startLine, startCol);
        }

        throw new ParseException("Unexpected character '" + c + "'", startLine, startCol);
    }

    private JsgfToken single(TokenType type, int startLine, int startCol) {
        String value = String.valueOf(source.charAt(pos));
        advance();
        return new JsgfToken(type, value, startLine, startCol, pos);
    }

    private JsgfToken readWord(int startLine, int startCol) {
        int start = pos;
        while (pos < source.length() && isWordChar(source.charAt(pos))) {
            advance();
        }
        return new JsgfToken(TokenType.WORD, source.substring(start, pos), startLine, startCol, pos);
    }

    private JsgfToken readRuleReference(int startLine, int startCol) {
        advance(); // '<'
        int start = pos;
        while (pos < source.length() && isRuleNameChar(source.charAt(pos))) {
            advance();
        }
        if (pos >= source.length() || source.charAt(pos) != '>') {
            throw new ParseException("Unterminated rule reference", startLine, startCol);
        }
        String name = source.substring(start, pos);
        advance(); // '>'
        if (name.isEmpty()) {
            throw new ParseException("Empty rule reference '<>'", startLine, startCol);
        }
        return new JsgfToken(TokenType.NONTERMINAL, name, startLine, startCol, pos);
    }

    private JsgfToken readWeight(int startLine, int startCol) {
        advance(); // opening '/'
        skipWhitespace();
        int start = pos;
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            advance();
        }
        int end = pos;
        skipWhitespace();
        if (pos >= source.length() || source.charAt(pos) != '/' || end == start) {
            throw new ParseException("Malformed weight, expected /number/", startLine, startCol);
        }
        String value = source.substring(start, end);
        advance(); // closing '/'
        return new JsgfToken(TokenType.WEIGHT, value, startLine, startCol, pos);
    }

    private void advance() {
        pos++;
        column++;
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || WORD_PUNCTUATION.indexOf(c) >= 0;
    }

    static boolean isRuleNameChar(char c) {
        return Character.isLetterOrDigit(c) || RULE_NAME_PUNCTUATION.indexOf(c) >= 0;
    }
}
