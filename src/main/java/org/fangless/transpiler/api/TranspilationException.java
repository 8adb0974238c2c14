package org.fangless.transpiler.api;

/**
 * An exception that is thrown when one or more errors occur during the transpilation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the transpiler.
 */
public class TranspilationException extends Exception {

    /**
     * Constructs a new transpilation exception with the specified detail message.
     * @param message The detail message.
     */
    public TranspilationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new transpilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public TranspilationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new transpilation exception with the specified detail message and source information.
     * @param message The detail message.
     * @param sourceInfo The source information.
     */
    public TranspilationException(String message, SourceInfo sourceInfo) {
        super(String.format("%s at %s", message, sourceInfo), null);
    }
}
