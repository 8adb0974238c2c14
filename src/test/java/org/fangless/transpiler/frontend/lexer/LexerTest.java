package org.fangless.transpiler.frontend.lexer;

import org.fangless.transpiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that source text is converted into tokens, including the layout tokens
 * that encode indentation, and that malformed input is reported to the diagnostics engine.
 */
public class LexerTest {

    private static List<Token> scan(String source, DiagnosticsEngine diagnostics) {
        return new Lexer(source, diagnostics, "test.py").scanTokens();
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).collect(Collectors.toList());
    }

    /**
     * Verifies a simple assignment: identifier, operator, literal value and position information.
     */
    @Test
    @Tag("unit")
    void testSimpleAssignment() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("x = 42\n", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).hasSize(5);
        assertThat(tokens.get(0)).extracting(Token::type, Token::text).containsExactly(TokenType.IDENTIFIER, "x");
        assertThat(tokens.get(1)).extracting(Token::type, Token::column).containsExactly(TokenType.EQUAL, 3);
        assertThat(tokens.get(2)).extracting(Token::type, Token::text, Token::value).containsExactly(TokenType.INTEGER, "42", 42L);
        assertThat(tokens.get(3).type()).isEqualTo(TokenType.NEWLINE);
        assertThat(tokens.get(4).type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(tokens.get(0).fileName()).isEqualTo("test.py");
    }

    /**
     * Verifies that a deeper line emits INDENT and a return to the outer level emits DEDENT.
     */
    @Test
    @Tag("unit")
    void testIndentAndDedent() {
        // Arrange
        String source = String.join("\n",
                "if x:",
                "    y = 1",
                "z = 2",
                "");

        // Act
        List<Token> tokens = scan(source, new DiagnosticsEngine());

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.IF, TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.INTEGER, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.INTEGER, TokenType.NEWLINE,
                TokenType.END_OF_FILE);
    }

    /**
     * Verifies that blank lines and comment-only lines produce no tokens and do not disturb indentation.
     */
    @Test
    @Tag("unit")
    void testBlankAndCommentLinesAreSkipped() {
        // Arrange
        String source = String.join("\n",
                "while x:",
                "",
                "    # a comment",
                "    y = 1  # trailing",
                "");

        // Act
        List<Token> tokens = scan(source, new DiagnosticsEngine());

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.WHILE, TokenType.IDENTIFIER, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.INTEGER, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.END_OF_FILE);
    }

    /**
     * Verifies that a missing final newline is supplied and pending DEDENTs are closed at end of input.
     */
    @Test
    @Tag("unit")
    void testEndOfInputClosesBlocks() {
        // Act
        List<Token> tokens = scan("def f():\n    return 1", new DiagnosticsEngine());

        // Assert
        assertThat(types(tokens)).endsWith(
                TokenType.RETURN, TokenType.INTEGER, TokenType.NEWLINE, TokenType.DEDENT, TokenType.END_OF_FILE);
    }

    /**
     * Verifies that line breaks inside brackets and after a backslash do not end the logical line.
     */
    @Test
    @Tag("unit")
    void testImplicitAndExplicitLineJoining() {
        // Arrange
        String source = "x = [1,\n     2]\ny = 1 + \\\n    2\n";

        // Act
        List<Token> tokens = scan(source, new DiagnosticsEngine());

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.LEFT_BRACKET, TokenType.INTEGER, TokenType.COMMA,
                TokenType.INTEGER, TokenType.RIGHT_BRACKET, TokenType.NEWLINE,
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.INTEGER, TokenType.PLUS, TokenType.INTEGER,
                TokenType.NEWLINE, TokenType.END_OF_FILE);
    }

    /**
     * Verifies string literals: both quote styles, escapes and triple-quoted strings spanning lines.
     */
    @Test
    @Tag("unit")
    void testStringLiterals() {
        // Arrange
        String source = "a = \"tab\\there\" 'it\\'s'\nb = \"\"\"one\ntwo\"\"\"\n";
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan(source, diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        List<Object> strings = tokens.stream()
                .filter(t -> t.type() == TokenType.STRING)
                .map(Token::value)
                .collect(Collectors.toList());
        assertThat(strings).containsExactly("tab\there", "it's", "one\ntwo");
    }

    /**
     * Verifies integer literals in every radix, digit separators, and float forms.
     */
    @Test
    @Tag("unit")
    void testNumberLiterals() {
        // Act
        List<Token> tokens = scan("0x1F 0b101 0o17 1_000 3.5 1e3 .5\n", new DiagnosticsEngine());

        // Assert
        List<Object> values = tokens.stream()
                .filter(t -> t.type() == TokenType.INTEGER || t.type() == TokenType.FLOAT)
                .map(Token::value)
                .collect(Collectors.toList());
        assertThat(values).containsExactly(31L, 5L, 15L, 1000L, 3.5, 1000.0, 0.5);
    }

    /**
     * Verifies compound operators are scanned greedily.
     */
    @Test
    @Tag("unit")
    void testCompoundOperators() {
        // Act
        List<Token> tokens = scan("a += 1; b //= 2 ** 3 != 4\n", new DiagnosticsEngine());

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.IDENTIFIER, TokenType.PLUS_EQUAL, TokenType.INTEGER, TokenType.SEMICOLON,
                TokenType.IDENTIFIER, TokenType.DOUBLE_SLASH_EQUAL, TokenType.INTEGER, TokenType.DOUBLE_STAR,
                TokenType.INTEGER, TokenType.BANG_EQUAL, TokenType.INTEGER, TokenType.NEWLINE, TokenType.END_OF_FILE);
    }

    /**
     * Verifies keyword recognition, including keywords of unsupported constructs.
     */
    @Test
    @Tag("unit")
    void testKeywords() {
        // Act
        List<Token> tokens = scan("not in is None True class lambda name\n", new DiagnosticsEngine());

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.NOT, TokenType.IN, TokenType.IS, TokenType.NONE, TokenType.TRUE,
                TokenType.UNSUPPORTED_KEYWORD, TokenType.UNSUPPORTED_KEYWORD, TokenType.IDENTIFIER,
                TokenType.NEWLINE, TokenType.END_OF_FILE);
    }

    /**
     * Verifies that an unexpected character is reported with its position.
     */
    @Test
    @Tag("unit")
    void testUnexpectedCharacterIsReported() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        scan("x = $\n", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary()).contains("Unexpected character: $").contains("test.py:1:5");
    }

    /**
     * Verifies that a dedent to a width that was never opened is an error.
     */
    @Test
    @Tag("unit")
    void testInconsistentDedentIsReported() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        scan("if x:\n    a = 1\n  b = 2\n", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary()).contains("Unindent does not match");
    }

    /**
     * Verifies that an unterminated string is reported.
     */
    @Test
    @Tag("unit")
    void testUnterminatedStringIsReported() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        scan("s = \"open\n", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary()).contains("Unterminated string.");
    }

    /**
     * Verifies that indentation mixing tabs and spaces is accepted but reported as a warning.
     */
    @Test
    @Tag("unit")
    void testMixedTabsAndSpacesWarns() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<Token> tokens = scan("if x:\n \tpass\n\tpass\n", diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(types(tokens)).containsSubsequence(TokenType.INDENT, TokenType.PASS, TokenType.NEWLINE,
                TokenType.PASS, TokenType.NEWLINE, TokenType.DEDENT);
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0).toString())
                .startsWith("[WARNING] test.py:2:1: Indentation mixes tabs and spaces");
    }
}
