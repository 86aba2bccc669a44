package org.quill.compiler.frontend.parser.features.conditional;

import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;
import org.quill.compiler.frontend.parser.ast.ConditionalBranch;
import org.quill.compiler.frontend.parser.ast.ConditionalNode;

import java.util.List;

/**
 * Handles {@code if expr} and {@code unless expr}, which open a new conditional chain.
 */
public class IfKeywordHandler implements IKeywordHandler {

    private final boolean negated;

    /**
     * @param negated {@code true} for {@code unless}.
     */
    public IfKeywordHandler(boolean negated) {
        this.negated = negated;
    }

    @Override
    public ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException {
        Token predicate = context.consume(TokenType.ARGUMENT, "a condition");
        ConditionalBranch branch = new ConditionalBranch(predicate.stringValue(), negated, List.of(), keyword.source());
        ConditionalNode node = new ConditionalNode(List.of(branch), null, keyword.source());
        return ParsedLine.container(node, (current, children) -> ((ConditionalNode) current).withBranchBody(0, children));
    }
}
