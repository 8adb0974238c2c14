package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * An {@code import} or {@code from ... import ...} statement. Modules are not supported,
 * so the statement is parsed and then ignored by code generation.
 *
 * @param module The dotted module name.
 * @param names The imported names for the {@code from} form; empty for a plain import.
 * @param sourceInfo The position of the keyword, or {@code null}.
 */
public record Import(String module, List<String> names, SourceInfo sourceInfo) implements Stmt {

    public Import {
        Objects.requireNonNull(module, "module");
        names = List.copyOf(names);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitImport(this);
    }
}
