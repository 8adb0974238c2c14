package org.fangless.transpiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static logging facade used by all transpiler phases.
 * <p>
 * The verbosity set with {@link #setLevel(int)} (0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE) gates
 * messages before they reach SLF4J, so embedding code can quiet the transpiler without touching the
 * logging backend. Messages take SLF4J {@code {}} placeholders and are formatted only when they pass
 * both gates. Output goes to stderr through Logback; stdout is reserved for generated code.
 */
public final class TranspilerLogger {

    public static final int ERROR = 0;
    public static final int WARN = 1;
    public static final int INFO = 2;
    public static final int DEBUG = 3;
    /** Per-statement lowering output, enabled by {@code -vv}. */
    public static final int TRACE = 4;

    private static final Logger LOG = LoggerFactory.getLogger(TranspilerLogger.class);

    private static volatile int level = INFO;

    private TranspilerLogger() {}

    /**
     * @param newLevel The verbosity, clamped to {@link #ERROR}..{@link #TRACE}.
     */
    public static void setLevel(int newLevel) {
        level = Math.max(ERROR, Math.min(TRACE, newLevel));
    }

    /**
     * @param messageLevel The level of a message about to be logged.
     * @return {@code true} if the current verbosity lets it through.
     */
    public static boolean isEnabled(int messageLevel) {
        return messageLevel <= level;
    }

    public static void error(String format, Object... args) {
        if (isEnabled(ERROR)) LOG.error(format, args);
    }

    public static void warn(String format, Object... args) {
        if (isEnabled(WARN)) LOG.warn(format, args);
    }

    public static void info(String format, Object... args) {
        if (isEnabled(INFO)) LOG.info(format, args);
    }

    public static void debug(String format, Object... args) {
        if (isEnabled(DEBUG)) LOG.debug(format, args);
    }

    public static void trace(String format, Object... args) {
        if (isEnabled(TRACE)) LOG.trace(format, args);
    }
}
