package com.jsgf.tools.parser;

import com.jsgf.tools.exception.ParseException;
import com.jsgf.tools.model.AlternativeNode;
import com.jsgf.tools.model.Choice;
import com.jsgf.tools.model.GrammarNode;
import com.jsgf.tools.model.GroupNode;
import com.jsgf.tools.model.NonTerminalNode;
import com.jsgf.tools.model.OptionalNode;
import com.jsgf.tools.model.Rule;
import com.jsgf.tools.model.SequenceNode;
import com.jsgf.tools.model.TerminalNode;
import com.jsgf.tools.parser.JsgfToken.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for a single rule definition.
 *
 * <pre>
 * rule        := "public"? nonterminal "=" alternation ";"
 * alternation := branch ( "|" branch )*
 * branch      := weight? sequence
 * sequence    := atom+
 * atom        := token | nonterminal | "(" alternation ")" | "[" alternation "]"
 * </pre>
 *
 * A one-atom sequence is returned as the atom itself, and an alternation with a single
 * unweighted branch as that branch.
 */
public class JsgfRuleParser {

    static final String PUBLIC_KEYWORD = "public";

    private final List<JsgfToken> tokens;
    private final JsgfToken start;
    private int pos = 0;

    /**
     * @param tokens the tokens of exactly one rule definition, ending with its ';'
     */
    public JsgfRuleParser(List<JsgfToken> tokens) {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("No tokens to parse");
        }
        this.tokens = tokens;
        this.start = tokens.get(0);
    }

    public Rule parseRule() {
        boolean isPublic = false;
        if (check(TokenType.WORD) && PUBLIC_KEYWORD.equals(peek().getValue())
                && checkNext(TokenType.NONTERMINAL)) {
            advance();
            isPublic = true;
        }

        String name = expect(TokenType.NONTERMINAL, "rule name").getValue();
        expect(TokenType.EQUALS, "'='");
        GrammarNode expansion = parseAlternation();
        expect(TokenType.SEMICOLON, "';'");

        if (!isAtEnd()) {
            throw error("end of rule");
        }
        return new Rule(name, expansion, isPublic);
    }

    private GrammarNode parseAlternation() {
        List<Choice> choices = new ArrayList<>();
        boolean weighted = false;

        do {
            if (check(TokenType.WEIGHT)) {
                double weight = parseWeight(advance());
                choices.add(Choice.weighted(parseSequence(), weight));
                weighted = true;
            } else {
                choices.add(Choice.of(parseSequence()));
            }
        } while (match(TokenType.PIPE));

        if (choices.size() == 1 && !weighted) {
            return choices.get(0).getNode();
        }
        return new AlternativeNode(choices);
    }

    private GrammarNode parseSequence() {
        List<GrammarNode> atoms = new ArrayList<>();
        while (!isAtEnd() && peek().startsAtom()) {
            atoms.add(parseAtom());
        }
        if (atoms.isEmpty()) {
            throw error("token, rule reference, '(' or '['");
        }
        return atoms.size() == 1 ? atoms.get(0) : new SequenceNode(atoms);
    }

    private GrammarNode parseAtom() {
        JsgfToken token = advance();
        switch (token.getType()) {
            case WORD:
                return new TerminalNode(token.getValue());
            case NONTERMINAL:
                return new NonTerminalNode(token.getValue());
            case LPAREN: {
                GrammarNode inner = parseAlternation();
                expect(TokenType.RPAREN, "')'");
                return new GroupNode(inner);
            }
            case LBRACKET: {
                GrammarNode inner = parseAlternation();
                expect(TokenType.RBRACKET, "']'");
                return new OptionalNode(inner);
            }
            default:
                throw new IllegalStateException("Not an atom: " + token);
        }
    }

    private double parseWeight(JsgfToken token) {
        double weight;
        try {
            weight = Double.parseDouble(token.getValue());
        } catch (NumberFormatException e) {
            throw new ParseException("Malformed rule: invalid weight '/" + token.getValue() + "/' at line "
                    + token.getLine() + ", column " + token.getColumn(), start.getLine(), start.getColumn(), e);
        }
        if (!(weight > 0) || Double.isInfinite(weight)) {
            throw new ParseException("Malformed rule: weight must be a positive number, got '/" + token.getValue()
                    + "/' at line " + token.getLine() + ", column " + token.getColumn(),
                    start.getLine(), start.getColumn());
        }
        return weight;
    }

    private ParseException error(String expected) {
        JsgfToken found = peek();
        String where = found.getType() == TokenType.EOF
                ? ""
                : " at line " + found.getLine() + ", column " + found.getColumn();
        return new ParseException("Malformed rule: expected " + expected + " but found " + found.describe() + where,
                start.getLine(), start.getColumn());
    }

    private boolean isAtEnd() {
        return pos >= tokens.size() || tokens.get(pos).getType() == TokenType.EOF;
    }

    private JsgfToken peek() {
        if (pos >= tokens.size()) {
            JsgfToken last = tokens.get(tokens.size() - 1);
            return new JsgfToken(TokenType.EOF, "", last.getLine(), last.getColumn(), last.getEndOffset());
        }
        return tokens.get(pos);
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek().getType() == type;
    }

    private boolean checkNext(TokenType type) {
        return pos + 1 < tokens.size() && tokens.get(pos + 1).getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private JsgfToken advance() {
        JsgfToken token = peek();
        if (!isAtEnd()) pos++;
        return token;
    }

    private JsgfToken expect(TokenType type, String description) {
        if (check(type)) {
            return advance();
        }
        throw error(description);
    }
}
