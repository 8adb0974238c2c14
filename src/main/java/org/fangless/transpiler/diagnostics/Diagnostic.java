package org.fangless.transpiler.diagnostics;

import org.fangless.transpiler.api.SourceInfo;

/**
 * A problem found in the source before code generation, rendered as
 * {@code [ERROR] file:line:col: message}.
 *
 * @param severity Whether the problem stops transpilation.
 * @param message The human-readable description.
 * @param location Where the problem was found.
 */
public record Diagnostic(Severity severity, String message, SourceInfo location) {

    /**
     * How serious a diagnostic is.
     */
    public enum Severity {
        /** Stops transpilation after the current phase. */
        ERROR,
        /** Logged; the program is still transpiled. */
        WARNING
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + location + ": " + message;
    }
}
