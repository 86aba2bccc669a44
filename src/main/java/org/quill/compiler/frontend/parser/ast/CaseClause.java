package org.quill.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A clause of a {@link CaseNode}.
 */
public sealed interface CaseClause extends AstNode permits WhenNode, DefaultNode {

    /**
     * @return The clause content; empty for a {@code when} that falls through.
     */
    List<AstNode> body();

    /**
     * @param body The new content.
     * @return A copy of this clause with the content replaced.
     */
    CaseClause withBody(List<AstNode> body);

    @Override
    default List<List<AstNode>> getBodies() {
        return List.of(body());
    }

    @Override
    default AstNode withBodies(List<List<AstNode>> bodies) {
        return withBody(bodies.get(0));
    }
}
