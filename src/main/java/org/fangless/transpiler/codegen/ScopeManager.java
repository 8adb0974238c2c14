package org.fangless.transpiler.codegen;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Tracks which names have been declared in the current and enclosing lexical blocks.
 * The generators consult it to choose between a typed declaration and a plain reassignment.
 * <p>
 * One instance is shared by reference between all generators of a {@link CodeGenerator};
 * declarations made by one generator must be visible to the others.
 */
public class ScopeManager {

    private final Deque<Set<String>> scopes = new ArrayDeque<>();

    /**
     * Creates a manager holding only the global scope.
     */
    public ScopeManager() {
        scopes.push(new HashSet<>());
    }

    /**
     * Pushes a new, empty innermost scope.
     */
    public void enterScope() {
        scopes.push(new HashSet<>());
    }

    /**
     * Pops the innermost scope.
     * @throws IllegalStateException if only the global scope remains.
     */
    public void exitScope() {
        if (scopes.size() <= 1) {
            throw new IllegalStateException("Cannot exit the global scope.");
        }
        scopes.pop();
    }

    /**
     * Alias of {@link #enterScope()} used by the generators.
     */
    public void push() {
        enterScope();
    }

    /**
     * Pops the innermost scope, doing nothing if only the global scope remains.
     */
    public void pop() {
        if (scopes.size() > 1) {
            scopes.pop();
        }
    }

    /**
     * Declares a name in the innermost scope. Declaring a name twice is allowed.
     * @param name The name to declare.
     */
    public void declare(String name) {
        scopes.peek().add(name);
    }

    /**
     * Checks whether a name is declared in the innermost scope or any enclosing one.
     * @param name The name to look up.
     * @return {@code true} if the name is visible.
     */
    public boolean exists(String name) {
        Iterator<Set<String>> it = scopes.iterator();
        while (it.hasNext()) {
            if (it.next().contains(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether a name is declared in the innermost scope only.
     * @param name The name to look up.
     * @return {@code true} if the innermost scope declares the name.
     */
    public boolean existsInCurrentScope(String name) {
        return scopes.peek().contains(name);
    }

    /**
     * Discards all scopes and starts over with a single, empty global scope.
     */
    public void reset() {
        scopes.clear();
        scopes.push(new HashSet<>());
    }

    /**
     * @return The number of scopes on the stack, including the global one.
     */
    public int depth() {
        return scopes.size();
    }
}
