package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.List;

/**
 * The {@code default} clause of a case.
 *
 * @param body The clause content.
 * @param source The position of the keyword.
 */
public record DefaultNode(List<AstNode> body, SourceInfo source) implements CaseClause {

    public DefaultNode {
        body = List.copyOf(body);
    }

    @Override
    public CaseClause withBody(List<AstNode> newBody) {
        return new DefaultNode(newBody, source);
    }
}
