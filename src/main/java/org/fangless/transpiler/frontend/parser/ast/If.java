package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An {@code if} statement with any number of {@code elif} branches and an optional {@code else}.
 *
 * @param condition The {@code if} condition.
 * @param body The {@code if} body.
 * @param elifs The {@code elif} branches in source order.
 * @param orelse The {@code else} body, or {@code null}.
 * @param sourceInfo The position of the keyword, or {@code null}.
 */
public record If(Expr condition, Block body, List<ElifClause> elifs, Block orelse, SourceInfo sourceInfo) implements Stmt {

    public If {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(body, "body");
        elifs = List.copyOf(elifs);
    }

    public If(Expr condition, Block body, List<ElifClause> elifs, Block orelse) {
        this(condition, body, elifs, orelse, null);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.add(body);
        for (ElifClause elif : elifs) {
            children.add(elif.condition());
            children.add(elif.body());
        }
        if (orelse != null) {
            children.add(orelse);
        }
        return children;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
