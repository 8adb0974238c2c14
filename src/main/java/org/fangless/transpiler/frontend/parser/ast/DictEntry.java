package org.fangless.transpiler.frontend.parser.ast;

import java.util.Objects;

/**
 * One {@code key: value} pair of a dict literal.
 *
 * @param key The key expression.
 * @param value The value expression.
 */
public record DictEntry(Expr key, Expr value) {

    public DictEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
