package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.List;

/**
 * A mixin definition.
 *
 * @param name The mixin name.
 * @param params The positional parameters.
 * @param restParam The name of the {@code ...rest} parameter, or null.
 * @param body The mixin body.
 * @param source The position of the keyword.
 */
public record MixinDefNode(String name, List<MixinParameter> params, String restParam, List<AstNode> body, SourceInfo source) implements AstNode {

    public MixinDefNode {
        params = List.copyOf(params);
        body = List.copyOf(body);
    }

    @Override
    public List<List<AstNode>> getBodies() {
        return List.of(body);
    }

    @Override
    public AstNode withBodies(List<List<AstNode>> bodies) {
        return new MixinDefNode(name, params, restParam, bodies.get(0), source);
    }
}
