package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.List;

/**
 * One inlined mixin call: the parameter bindings of that expansion and the expanded body.
 *
 * @param mixinName The expanded mixin.
 * @param bindings The parameter bindings in declaration order.
 * @param body The expanded body.
 * @param source The position of the call.
 */
public record MixinScopeNode(String mixinName, List<ParameterBinding> bindings, List<AstNode> body, SourceInfo source) implements AstNode {

    public MixinScopeNode {
        bindings = List.copyOf(bindings);
        body = List.copyOf(body);
    }

    @Override
    public List<List<AstNode>> getBodies() {
        return List.of(body);
    }

    @Override
    public AstNode withBodies(List<List<AstNode>> bodies) {
        return new MixinScopeNode(mixinName, bindings, bodies.get(0), source);
    }
}
