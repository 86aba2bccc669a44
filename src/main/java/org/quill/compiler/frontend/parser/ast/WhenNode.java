package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.List;

/**
 * A {@code when v1, v2} clause.
 *
 * @param values The value expressions compared with the case subject.
 * @param body The clause content.
 * @param source The position of the keyword.
 */
public record WhenNode(List<String> values, List<AstNode> body, SourceInfo source) implements CaseClause {

    public WhenNode {
        values = List.copyOf(values);
        body = List.copyOf(body);
    }

    @Override
    public CaseClause withBody(List<AstNode> newBody) {
        return new WhenNode(values, newBody, source);
    }
}
