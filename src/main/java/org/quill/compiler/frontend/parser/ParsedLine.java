package org.quill.compiler.frontend.parser;

import org.quill.compiler.frontend.parser.ast.AstNode;

/**
 * The result of parsing one line.
 *
 * @param node The node the line produced.
 * @param container How deeper lines attach to the node, or null if it takes no children.
 * @param replacesPrevious Whether the node replaces the previous sibling instead of following it.
 */
public record ParsedLine(AstNode node, ContainerAttach container, boolean replacesPrevious) {

    /**
     * @param node A node without children.
     * @return The parsed line.
     */
    public static ParsedLine leaf(AstNode node) {
        return new ParsedLine(node, null, false);
    }

    /**
     * @param node A node that takes the deeper lines as content.
     * @param container How the content attaches.
     * @return The parsed line.
     */
    public static ParsedLine container(AstNode node, ContainerAttach container) {
        return new ParsedLine(node, container, false);
    }

    /**
     * @param node The previous sibling, extended by this line.
     * @param container How the content of this line attaches.
     * @return The parsed line.
     */
    public static ParsedLine chained(AstNode node, ContainerAttach container) {
        return new ParsedLine(node, container, true);
    }
}
