package org.fangless.transpiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public transpiler API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The line number (1-based).
 * @param columnNumber The column number (1-based).
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
    }
}
