package org.fangless.transpiler.frontend.parser;

import org.fangless.transpiler.api.SourceInfo;
import org.fangless.transpiler.api.TranspilerErrorCode;

/**
 * Aborts parsing at the first syntax error. The error has already been reported to the
 * {@link org.fangless.transpiler.diagnostics.DiagnosticsEngine} when this is thrown.
 */
public class ParseException extends RuntimeException {

    private final TranspilerErrorCode code;
    private final SourceInfo sourceInfo;

    /**
     * Creates a new parse exception.
     * @param message The error message.
     * @param code The error code.
     * @param sourceInfo The position of the offending token.
     */
    public ParseException(String message, TranspilerErrorCode code, SourceInfo sourceInfo) {
        super(message);
        this.code = code;
        this.sourceInfo = sourceInfo;
    }

    public TranspilerErrorCode getCode() {
        return code;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
