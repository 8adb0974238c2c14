package org.fangless.transpiler.frontend.parser.ast;

import java.util.Objects;

/**
 * One {@code elif cond:} branch of an {@link If}.
 *
 * @param condition The branch condition.
 * @param body The branch body.
 */
public record ElifClause(Expr condition, Block body) {

    public ElifClause {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(body, "body");
    }
}
