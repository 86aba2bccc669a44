package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Nodes are immutable. A node with nested content exposes it as a list of bodies so a
 * generic {@link org.quill.compiler.frontend.TreeWalker} can traverse and rebuild the
 * tree without knowing the structure of each node.
 */
public interface AstNode {

    /**
     * @return The position of the construct in its template.
     */
    SourceInfo source();

    /**
     * Returns the nested node lists of this node, in document order. Absent optional
     * bodies (e.g. a missing else body) are not included.
     *
     * @return The bodies, empty for leaf nodes.
     */
    default List<List<AstNode>> getBodies() {
        return Collections.emptyList();
    }

    /**
     * Creates a new instance of this node with the given bodies.
     *
     * @param bodies Replacement bodies, one for each entry of {@link #getBodies()} in the same order.
     * @return A new instance of this node, or this node if it has no bodies.
     */
    default AstNode withBodies(List<List<AstNode>> bodies) {
        return this;
    }

    /**
     * Returns all direct child nodes, across all bodies.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        List<List<AstNode>> bodies = getBodies();
        if (bodies.isEmpty()) {
            return Collections.emptyList();
        }
        List<AstNode> children = new ArrayList<>();
        bodies.forEach(children::addAll);
        return children;
    }
}
