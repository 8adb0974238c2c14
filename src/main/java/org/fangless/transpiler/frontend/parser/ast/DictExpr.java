package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A dict literal.
 *
 * @param pairs The key/value pairs in source order.
 * @param sourceInfo The position of the opening brace, or {@code null}.
 */
public record DictExpr(List<DictEntry> pairs, SourceInfo sourceInfo) implements Expr {

    public DictExpr {
        pairs = List.copyOf(pairs);
    }

    public DictExpr(List<DictEntry> pairs) {
        this(pairs, null);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        for (DictEntry pair : pairs) {
            children.add(pair.key());
            children.add(pair.value());
        }
        return children;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitDict(this);
    }
}
