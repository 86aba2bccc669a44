package org.quill.compiler.frontend;

import org.quill.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing and rewriting an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between compiler stages and the AST structure.
 */
public class TreeWalker {

    /**
     * Decides how one node is rewritten.
     *
     * @param <E> The exception type the rewriter may throw.
     */
    @FunctionalInterface
    public interface NodeRewriter<E extends Exception> {
        /**
         * @param node The node to inspect.
         * @return The nodes that replace {@code node} (an empty list removes it), or null
         *         to keep the node and rewrite inside its bodies.
         * @throws E if the node cannot be rewritten.
         */
        List<AstNode> rewrite(AstNode node) throws E;
    }

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a list of AST nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and its children recursively.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Rewrites a node list. Nodes are offered to the rewriter in document order; nodes
     * it keeps are rebuilt with rewritten bodies. Replacement nodes are not revisited.
     *
     * @param nodes The nodes to rewrite.
     * @param rewriter The rewriter.
     * @param <E> The exception type the rewriter may throw.
     * @return The rewritten list.
     * @throws E if the rewriter fails.
     */
    public static <E extends Exception> List<AstNode> rewrite(List<AstNode> nodes, NodeRewriter<E> rewriter) throws E {
        List<AstNode> result = new ArrayList<>(nodes.size());
        for (AstNode node : nodes) {
            List<AstNode> replacement = rewriter.rewrite(node);
            if (replacement != null) {
                result.addAll(replacement);
            } else {
                result.add(rewriteBodies(node, rewriter));
            }
        }
        return result;
    }

    /**
     * Rebuilds a node with each of its bodies rewritten.
     *
     * @param node The node.
     * @param rewriter The rewriter.
     * @param <E> The exception type the rewriter may throw.
     * @return The rebuilt node, or the node itself if it has no bodies.
     * @throws E if the rewriter fails.
     */
    public static <E extends Exception> AstNode rewriteBodies(AstNode node, NodeRewriter<E> rewriter) throws E {
        List<List<AstNode>> bodies = node.getBodies();
        if (bodies.isEmpty()) {
            return node;
        }
        List<List<AstNode>> rewritten = new ArrayList<>(bodies.size());
        for (List<AstNode> body : bodies) {
            rewritten.add(rewrite(body, rewriter));
        }
        return node.withBodies(rewritten);
    }
}
