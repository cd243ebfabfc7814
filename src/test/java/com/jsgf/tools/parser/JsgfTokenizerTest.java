package com.jsgf.tools.parser;

import com.jsgf.tools.exception.ParseException;
import com.jsgf.tools.parser.JsgfToken.TokenType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JsgfTokenizer.
 */
class JsgfTokenizerTest {

    @Test
    void testTokenizeRuleDefinition() {
        List<JsgfToken> tokens = new JsgfTokenizer("public <greeting> = /5/ hello | [ hi ] ( there );").tokenize();

        assertThat(tokens.stream().map(JsgfToken::getType).collect(Collectors.toList())).containsExactly(
                TokenType.WORD, TokenType.NONTERMINAL, TokenType.EQUALS, TokenType.WEIGHT, TokenType.WORD,
                TokenType.PIPE, TokenType.LBRACKET, TokenType.WORD, TokenType.RBRACKET,
                TokenType.LPAREN, TokenType.WORD, TokenType.RPAREN, TokenType.SEMICOLON, TokenType.EOF);
        assertThat(tokens.get(1).getValue()).isEqualTo("greeting");
        assertThat(tokens.get(3).getValue()).isEqualTo("5");
    }

    @Test
    void testPositionsAcrossLines() {
        List<JsgfToken> tokens = new JsgfTokenizer("<a> =\n  hello;").tokenize();

        assertThat(tokens.get(0).getLine()).isEqualTo(1);
        assertThat(tokens.get(0).getColumn()).isEqualTo(1);
        assertThat(tokens.get(2).getValue()).isEqualTo("hello");
        assertThat(tokens.get(2).getLine()).isEqualTo(2);
        assertThat(tokens.get(2).getColumn()).isEqualTo(3);
    }

    @Test
    void testStartPositionOffsetsTokens() {
        List<JsgfToken> tokens = new JsgfTokenizer(" <b> = y;", 4, 16).tokenize();

        assertThat(tokens.get(0).getLine()).isEqualTo(4);
        assertThat(tokens.get(0).getColumn()).isEqualTo(17);
    }

    @Test
    void testEndOffsetPointsPastToken() {
        List<JsgfToken> tokens = new JsgfTokenizer("<a> = x; rest").tokenize();

        JsgfToken semicolon = tokens.get(3);
        assertThat(semicolon.getType()).isEqualTo(TokenType.SEMICOLON);
        assertThat(semicolon.getEndOffset()).isEqualTo(8);
    }

    @Test
    void testWhitespaceInsideWeightMarkers() {
        List<JsgfToken> tokens = new JsgfTokenizer("/ 2.5 / hello").tokenize();

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.WEIGHT);
        assertThat(tokens.get(0).getValue()).isEqualTo("2.5");
        assertThat(tokens.get(1).getValue()).isEqualTo("hello");
        assertThat(tokens.get(1).getColumn()).isEqualTo(9);
    }

    @Test
    void testEmptyInputYieldsOnlyEof() {
        List<JsgfToken> tokens = new JsgfTokenizer("   \n  ").tokenize();

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.EOF);
    }

    @ParameterizedTest
    @CsvSource({
            "<start>, start",
            "<com.example.digits>, com.example.digits",
            "<a:b;c>, a:b;c",
            "<$x_y-z>, $x_y-z"
    })
    void testRuleNameCharacters(String source, String expectedName) {
        JsgfToken token = new JsgfTokenizer(source).tokenize().get(0);

        assertThat(token.getType()).isEqualTo(TokenType.NONTERMINAL);
        assertThat(token.getValue()).isEqualTo(expectedName);
    }

    @ParameterizedTest
    @ValueSource(strings = {"don't", "twenty-one", "snake_case", "café", "42"})
    void testWordCharacters(String word) {
        List<JsgfToken> tokens = new JsgfTokenizer(word).tokenize();

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.WORD);
        assertThat(tokens.get(0).getValue()).isEqualTo(word);
    }

    @Test
    void testUnexpectedCharacterReportsPosition() {
        JsgfTokenizer tokenizer = new JsgfTokenizer("public <a> = hello, world;");

        assertThatThrownBy(tokenizer::tokenize)
                .isInstanceOfSatisfying(ParseException.class, e -> {
                    assertThat(e.getLine()).isEqualTo(1);
                    assertThat(e.getColumn()).isEqualTo(19);
                    assertThat(e.getMessage()).contains("','");
                });
    }

    @ParameterizedTest
    @ValueSource(strings = {"<unterminated", "<>", "/5 hello", "// x", "/abc/", "/ /"})
    void testMalformedTokens(String source) {
        assertThatThrownBy(() -> new JsgfTokenizer(source).tokenize())
                .isInstanceOf(ParseException.class);
    }
}
