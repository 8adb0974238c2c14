package org.fangless.transpiler.diagnostics;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.fangless.transpiler.Transpiler;
import org.fangless.transpiler.api.TranspilationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains integration tests for the {@link TranspilerLogger} verbosity gate.
 * Events are captured with a Logback {@link ListAppender} while a small program is transpiled.
 */
public class TranspilerLoggerTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        logger = context.getLogger(TranspilerLogger.class);
        logger.setLevel(Level.TRACE);
        logger.setAdditive(false);
        appender = new ListAppender<>();
        appender.setContext(context);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        logger.setLevel(null);
        logger.setAdditive(true);
        TranspilerLogger.setLevel(TranspilerLogger.INFO);
    }

    private List<String> messagesAt(Level level) {
        return appender.list.stream()
                .filter(e -> e.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    /**
     * Verifies that the highest verbosity logs one trace line per lowered statement.
     */
    @Test
    @Tag("integration")
    void testTraceLogsEachLoweredStatement() throws TranspilationException {
        // Arrange
        Transpiler transpiler = new Transpiler();
        transpiler.setVerbosity(TranspilerLogger.TRACE);

        // Act
        transpiler.transpile(List.of("x = 1", "print(x)"), "trace.py");

        // Assert
        assertThat(messagesAt(Level.TRACE)).containsExactly(
                "Lowered Assign at trace.py:1:1 to 1 line(s).",
                "Lowered ExprStmt at trace.py:2:1 to 1 line(s).");
    }

    /**
     * Verifies that messages above the configured verbosity never reach SLF4J.
     */
    @Test
    @Tag("integration")
    void testVerbosityGatesMessages() throws TranspilationException {
        // Arrange
        Transpiler transpiler = new Transpiler();
        transpiler.setVerbosity(TranspilerLogger.INFO);

        // Act
        transpiler.transpile(List.of("x = 1"), "quiet.py");

        // Assert
        assertThat(TranspilerLogger.isEnabled(TranspilerLogger.DEBUG)).isFalse();
        assertThat(messagesAt(Level.TRACE)).isEmpty();
        assertThat(messagesAt(Level.DEBUG)).isEmpty();
        assertThat(messagesAt(Level.INFO)).containsExactly("Transpiled quiet.py (1 top-level statements).");
    }

    /**
     * Verifies that front-end warnings are logged once parsing succeeds.
     */
    @Test
    @Tag("integration")
    void testFrontEndWarningsAreLogged() throws TranspilationException {
        // Arrange
        Transpiler transpiler = new Transpiler();
        transpiler.setVerbosity(TranspilerLogger.WARN);

        // Act
        transpiler.transpile(List.of("x = 1", "x"), "warn.py");

        // Assert
        assertThat(messagesAt(Level.WARN)).containsExactly("[WARNING] warn.py:2:1: Statement has no effect.");
        assertThat(messagesAt(Level.INFO)).isEmpty();
    }
}
