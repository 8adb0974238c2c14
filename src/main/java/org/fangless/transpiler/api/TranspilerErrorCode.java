package org.fangless.transpiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during transpilation.
 * This decouples the test logic from the wording of error messages.
 */
public enum TranspilerErrorCode {
    // region Lexer & Parser Errors
    /** The token stream does not match the grammar. */
    SYNTAX_ERROR,
    /** A reserved keyword of a construct outside the supported subset (class, try, lambda, ...). */
    UNSUPPORTED_SYNTAX,
    /** The left-hand side of an assignment is not an assignable expression. */
    INVALID_ASSIGNMENT_TARGET,
    /** A comparison chain such as {@code a < b < c}. */
    CHAINED_COMPARISON,
    // endregion

    // region Code Generation Errors
    /** An AST node the generators have no lowering for. */
    UNSUPPORTED_NODE,
    /** An assignment target kind the generators cannot lower. */
    UNSUPPORTED_ASSIGNMENT_TARGET,
    /** A call whose callee is neither a name nor an attribute access. */
    UNSUPPORTED_CALL_TARGET,
    /** A function definition nested inside another statement. */
    NESTED_FUNCTION_DEFINITION,
    /** {@code break} without an enclosing loop. */
    BREAK_OUTSIDE_LOOP,
    /** {@code continue} without an enclosing loop. */
    CONTINUE_OUTSIDE_LOOP,
    /** {@code return} outside of a function body. */
    RETURN_OUTSIDE_FUNCTION,
    /** An augmented assignment to a name that was never assigned. */
    UNDECLARED_AUGMENTED_TARGET,
    /** {@code range} used as a loop iterable with a wrong number of arguments. */
    INVALID_RANGE_ARGUMENTS,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a file. */
    IO_ERROR_READING_FILE,
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
    // endregion
}
