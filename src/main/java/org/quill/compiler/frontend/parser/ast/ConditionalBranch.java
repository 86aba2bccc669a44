package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.List;

/**
 * One guarded branch of a {@link ConditionalNode}.
 *
 * @param predicate The predicate expression.
 * @param negated {@code true} for {@code unless}.
 * @param body The branch content.
 * @param source The position of the keyword.
 */
public record ConditionalBranch(String predicate, boolean negated, List<AstNode> body, SourceInfo source) {

    public ConditionalBranch {
        body = List.copyOf(body);
    }

    public ConditionalBranch withBody(List<AstNode> newBody) {
        return new ConditionalBranch(predicate, negated, newBody, source);
    }
}
