package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code each} / {@code for} loop.
 *
 * @param itemVar The name bound to each value.
 * @param indexVar The name bound to the index or key, or null.
 * @param iterableExpr The expression producing the list or map.
 * @param body The loop body.
 * @param elseBody The body rendered when there is nothing to iterate, or null.
 * @param source The position of the keyword.
 */
public record EachNode(
        String itemVar,
        String indexVar,
        String iterableExpr,
        List<AstNode> body,
        List<AstNode> elseBody,
        SourceInfo source
) implements AstNode {

    public EachNode {
        body = List.copyOf(body);
        elseBody = elseBody != null ? List.copyOf(elseBody) : null;
    }

    @Override
    public List<List<AstNode>> getBodies() {
        List<List<AstNode>> bodies = new ArrayList<>();
        bodies.add(body);
        if (elseBody != null) {
            bodies.add(elseBody);
        }
        return bodies;
    }

    @Override
    public AstNode withBodies(List<List<AstNode>> bodies) {
        return new EachNode(itemVar, indexVar, iterableExpr, bodies.get(0),
                elseBody != null ? bodies.get(1) : null, source);
    }

    public EachNode withBody(List<AstNode> newBody) {
        return new EachNode(itemVar, indexVar, iterableExpr, newBody, elseBody, source);
    }

    public EachNode withElse(List<AstNode> newElseBody) {
        return new EachNode(itemVar, indexVar, iterableExpr, body, newElseBody, source);
    }
}
