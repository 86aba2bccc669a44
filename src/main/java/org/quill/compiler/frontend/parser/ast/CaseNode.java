package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code case} statement.
 *
 * @param subject The expression compared with each clause's values.
 * @param clauses The clauses in order.
 * @param source The position of the keyword.
 */
public record CaseNode(String subject, List<CaseClause> clauses, SourceInfo source) implements AstNode {

    public CaseNode {
        clauses = List.copyOf(clauses);
    }

    @Override
    public List<List<AstNode>> getBodies() {
        List<List<AstNode>> bodies = new ArrayList<>();
        clauses.forEach(c -> bodies.add(c.body()));
        return bodies;
    }

    @Override
    public AstNode withBodies(List<List<AstNode>> bodies) {
        List<CaseClause> newClauses = new ArrayList<>();
        for (int i = 0; i < clauses.size(); i++) {
            newClauses.add(clauses.get(i).withBody(bodies.get(i)));
        }
        return new CaseNode(subject, newClauses, source);
    }
}
