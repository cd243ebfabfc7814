package com.jsgf.tools.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the grammar tokenizer.
 */
@Data
@AllArgsConstructor
public class JsgfToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;
    /** Offset just past the last character of this token in the tokenized text. */
    private int endOffset;

    public enum TokenType {
        WORD,
        NONTERMINAL,
        WEIGHT,
        EQUALS,
        PIPE,
        SEMICOLON,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        EOF
    }

    public boolean startsAtom() {
        return type == TokenType.WORD || type == TokenType.NONTERMINAL
                || type == TokenType.LPAREN || type == TokenType.LBRACKET;
    }

    public String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + value + "'";
    }
}
