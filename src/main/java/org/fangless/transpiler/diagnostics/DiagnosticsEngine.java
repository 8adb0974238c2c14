package org.fangless.transpiler.diagnostics;

import org.fangless.transpiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the errors and warnings of the lexer and parser for one transpilation.
 * <p>
 * Errors are checked by the {@code Transpiler} between phases and become the message of the
 * resulting exception. Warnings never stop the pipeline; they are handed to the
 * {@link TranspilerLogger} once the front end has finished.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> errors = new ArrayList<>();
    private final List<Diagnostic> warnings = new ArrayList<>();

    /**
     * @param message The error message.
     * @param location Where the error was found.
     */
    public void reportError(String message, SourceInfo location) {
        errors.add(new Diagnostic(Diagnostic.Severity.ERROR, message, location));
    }

    /**
     * @param message The warning message.
     * @param location Where the suspicious construct was found.
     */
    public void reportWarning(String message, SourceInfo location) {
        warnings.add(new Diagnostic(Diagnostic.Severity.WARNING, message, location));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @return The warnings in the order they were reported.
     */
    public List<Diagnostic> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Logs every collected warning at WARN level.
     */
    public void logWarnings() {
        for (Diagnostic warning : warnings) {
            TranspilerLogger.warn("{}", warning);
        }
    }

    /**
     * @return The errors, one per line, in the order they were reported.
     */
    public String summary() {
        return errors.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
