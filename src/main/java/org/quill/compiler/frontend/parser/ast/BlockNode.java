package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.List;

/**
 * A named, overridable content slot.
 *
 * @param name The block name.
 * @param mode How this declaration combines with inherited content.
 * @param content The block content.
 * @param source The position of the keyword.
 */
public record BlockNode(String name, BlockMode mode, List<AstNode> content, SourceInfo source) implements AstNode {

    public BlockNode {
        content = List.copyOf(content);
    }

    @Override
    public List<List<AstNode>> getBodies() {
        return List.of(content);
    }

    @Override
    public AstNode withBodies(List<List<AstNode>> bodies) {
        return withContent(bodies.get(0));
    }

    public BlockNode withContent(List<AstNode> newContent) {
        return new BlockNode(name, mode, newContent, source);
    }
}
