package org.fangless.transpiler.frontend.lexer;

import org.fangless.transpiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., identifier, integer, operator).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (a {@link Long}, {@link Double} or {@link String} for literals).
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * @return The position of this token as a {@link SourceInfo}.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }
}
