package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * All nodes are immutable records; their position in the source is optional.
 */
public interface AstNode {

    /**
     * @return The source position of this node, or {@code null} if the node was built synthetically.
     */
    SourceInfo sourceInfo();

    /**
     * Returns a list of the direct child nodes.
     * This allows generic traversal of the tree without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Collects child nodes from a mix of single nodes, collections of nodes and {@code null}s.
     *
     * @param parts Nodes or collections of nodes; {@code null} entries are skipped.
     * @return The flattened, ordered list of child nodes.
     */
    static List<AstNode> childrenOf(Object... parts) {
        List<AstNode> children = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof AstNode node) {
                children.add(node);
            } else if (part instanceof Collection<?> collection) {
                for (Object element : collection) {
                    if (element instanceof AstNode node) {
                        children.add(node);
                    }
                }
            }
        }
        return children;
    }
}
