package org.fangless.transpiler.codegen;

import org.fangless.transpiler.api.SourceInfo;
import org.fangless.transpiler.api.TranspilerErrorCode;

/**
 * Signals that a construct accepted by the parser cannot be lowered.
 * Code generation has no partial-output mode: the whole {@code generate()} call fails.
 */
public class CodegenException extends RuntimeException {

    private final TranspilerErrorCode code;
    private final String nodeKind;
    private final SourceInfo sourceInfo;

    /**
     * Creates a new code generation exception.
     * @param code The error code.
     * @param nodeKind The simple name of the offending AST node type.
     * @param message The error message.
     * @param sourceInfo The position of the offending node, or {@code null} if unknown.
     */
    public CodegenException(TranspilerErrorCode code, String nodeKind, String message, SourceInfo sourceInfo) {
        super(format(nodeKind, message, sourceInfo));
        this.code = code;
        this.nodeKind = nodeKind;
        this.sourceInfo = sourceInfo;
    }

    private static String format(String nodeKind, String message, SourceInfo sourceInfo) {
        String text = nodeKind + ": " + message;
        return sourceInfo != null ? text + " at " + sourceInfo : text;
    }

    public TranspilerErrorCode getCode() {
        return code;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
