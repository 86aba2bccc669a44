package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.List;

/**
 * A mixin call {@code +name(args)}.
 *
 * @param name The called mixin.
 * @param args The argument expressions.
 * @param blockContent The deeper indented block given with the call, or null.
 * @param source The position of the call.
 */
public record MixinCallNode(String name, List<String> args, List<AstNode> blockContent, SourceInfo source) implements AstNode {

    public MixinCallNode {
        args = List.copyOf(args);
        blockContent = blockContent != null ? List.copyOf(blockContent) : null;
    }

    @Override
    public List<List<AstNode>> getBodies() {
        return blockContent != null ? List.of(blockContent) : List.of();
    }

    @Override
    public AstNode withBodies(List<List<AstNode>> bodies) {
        return blockContent != null ? withBlockContent(bodies.get(0)) : this;
    }

    public MixinCallNode withBlockContent(List<AstNode> content) {
        return new MixinCallNode(name, args, content, source);
    }
}
