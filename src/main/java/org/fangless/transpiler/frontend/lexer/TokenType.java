package org.fangless.transpiler.frontend.lexer;

import java.util.Map;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Delimiters.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE,
    COMMA, COLON, DOT, SEMICOLON,

    // Operators.
    PLUS, MINUS, STAR, SLASH, DOUBLE_SLASH, PERCENT, DOUBLE_STAR,
    EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Assignment operators.
    EQUAL, PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL, DOUBLE_SLASH_EQUAL, PERCENT_EQUAL, DOUBLE_STAR_EQUAL,

    // Literals.
    /** A variable or function name. */
    IDENTIFIER,
    /** An integer literal; the value is a {@link Long}. */
    INTEGER,
    /** A floating-point literal; the value is a {@link Double}. */
    FLOAT,
    /** A string literal; the value is the decoded content. */
    STRING,

    // Keywords.
    DEF, RETURN, IF, ELIF, ELSE, WHILE, FOR, IN, NOT, AND, OR, IS,
    BREAK, CONTINUE, PASS, TRUE, FALSE, NONE, IMPORT, FROM, AS,
    /** A keyword of the source language whose construct is outside the supported subset. */
    UNSUPPORTED_KEYWORD,

    // Layout.
    /** The end of a logical line. */
    NEWLINE,
    /** An increase of the indentation level. */
    INDENT,
    /** A decrease of the indentation level. */
    DEDENT,
    /** Represents the end of the source file. */
    END_OF_FILE;

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("def", DEF),
            Map.entry("return", RETURN),
            Map.entry("if", IF),
            Map.entry("elif", ELIF),
            Map.entry("else", ELSE),
            Map.entry("while", WHILE),
            Map.entry("for", FOR),
            Map.entry("in", IN),
            Map.entry("not", NOT),
            Map.entry("and", AND),
            Map.entry("or", OR),
            Map.entry("is", IS),
            Map.entry("break", BREAK),
            Map.entry("continue", CONTINUE),
            Map.entry("pass", PASS),
            Map.entry("True", TRUE),
            Map.entry("False", FALSE),
            Map.entry("None", NONE),
            Map.entry("import", IMPORT),
            Map.entry("from", FROM),
            Map.entry("as", AS),
            Map.entry("class", UNSUPPORTED_KEYWORD),
            Map.entry("try", UNSUPPORTED_KEYWORD),
            Map.entry("except", UNSUPPORTED_KEYWORD),
            Map.entry("finally", UNSUPPORTED_KEYWORD),
            Map.entry("with", UNSUPPORTED_KEYWORD),
            Map.entry("lambda", UNSUPPORTED_KEYWORD),
            Map.entry("yield", UNSUPPORTED_KEYWORD),
            Map.entry("raise", UNSUPPORTED_KEYWORD),
            Map.entry("global", UNSUPPORTED_KEYWORD),
            Map.entry("nonlocal", UNSUPPORTED_KEYWORD),
            Map.entry("del", UNSUPPORTED_KEYWORD),
            Map.entry("assert", UNSUPPORTED_KEYWORD),
            Map.entry("async", UNSUPPORTED_KEYWORD),
            Map.entry("await", UNSUPPORTED_KEYWORD)
    );

    /**
     * Looks up the keyword type for an identifier-shaped word.
     * @param word The scanned word.
     * @return The keyword token type, or {@link #IDENTIFIER} if the word is not a keyword.
     */
    public static TokenType keywordOrIdentifier(String word) {
        return KEYWORDS.getOrDefault(word, IDENTIFIER);
    }
}
