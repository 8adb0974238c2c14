package org.fangless.transpiler.codegen;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ScopeManager}.
 */
public class ScopeManagerTest {

    /**
     * Verifies that names from enclosing scopes are visible and names from exited scopes are not.
     */
    @Test
    @Tag("unit")
    void testLookupThroughEnclosingScopes() {
        // Arrange
        ScopeManager scope = new ScopeManager();
        scope.declare("x");

        // Act
        scope.push();
        scope.declare("y");
        boolean outerVisible = scope.exists("x");
        boolean outerInCurrent = scope.existsInCurrentScope("x");
        scope.pop();

        // Assert
        assertThat(outerVisible).isTrue();
        assertThat(outerInCurrent).isFalse();
        assertThat(scope.exists("y")).isFalse();
        assertThat(scope.exists("x")).isTrue();
    }

    /**
     * Verifies that the soft pop never removes the global scope while the strict exit refuses to.
     */
    @Test
    @Tag("unit")
    void testGlobalScopeCannotBeRemoved() {
        // Arrange
        ScopeManager scope = new ScopeManager();
        scope.declare("g");

        // Act
        scope.pop();

        // Assert
        assertThat(scope.depth()).isEqualTo(1);
        assertThat(scope.exists("g")).isTrue();
        assertThatThrownBy(scope::exitScope).isInstanceOf(IllegalStateException.class);
    }

    /**
     * Verifies that reset drops every scope and every declaration.
     */
    @Test
    @Tag("unit")
    void testReset() {
        // Arrange
        ScopeManager scope = new ScopeManager();
        scope.declare("a");
        scope.enterScope();
        scope.declare("b");

        // Act
        scope.reset();

        // Assert
        assertThat(scope.depth()).isEqualTo(1);
        assertThat(scope.exists("a")).isFalse();
        assertThat(scope.exists("b")).isFalse();
    }
}
