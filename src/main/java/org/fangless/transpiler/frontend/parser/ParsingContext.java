package org.fangless.transpiler.frontend.parser;

import org.fangless.transpiler.api.TranspilerErrorCode;
import org.fangless.transpiler.frontend.lexer.Token;
import org.fangless.transpiler.frontend.lexer.TokenType;

/**
 * An interface that encapsulates the cursor state during parsing.
 * It gives sub-parsers such as the {@link ExpressionParser} access to the token stream
 * without coupling them directly to the statement parser.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks the type of the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type, false otherwise.
     */
    boolean checkNext(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * If not, it reports an error and aborts parsing.
     * @param type The expected token type.
     * @param errorMessage The error message to report if the token type does not match.
     * @return The consumed token.
     * @throws ParseException if the current token is of a different type.
     */
    Token consume(TokenType type, String errorMessage);

    /**
     * Reports an error at the given token and creates the exception that aborts parsing.
     * @param token The offending token.
     * @param message The error message.
     * @param code The error code.
     * @return The exception to throw.
     */
    ParseException error(Token token, String message, TranspilerErrorCode code);

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
