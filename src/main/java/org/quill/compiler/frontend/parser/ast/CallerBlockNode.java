package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.List;

/**
 * The block content of a mixin call, placed where the mixin body had its bare
 * {@code block}. It is rendered in the scope of the call, not in the scope of the
 * expansion that contains it.
 *
 * @param content The expanded block content.
 * @param source The position of the call.
 */
public record CallerBlockNode(List<AstNode> content, SourceInfo source) implements AstNode {

    public CallerBlockNode {
        content = List.copyOf(content);
    }

    @Override
    public List<List<AstNode>> getBodies() {
        return List.of(content);
    }

    @Override
    public AstNode withBodies(List<List<AstNode>> bodies) {
        return new CallerBlockNode(bodies.get(0), source);
    }
}
