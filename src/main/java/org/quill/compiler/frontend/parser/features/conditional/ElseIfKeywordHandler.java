package org.quill.compiler.frontend.parser.features.conditional;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;
import org.quill.compiler.frontend.parser.ast.AstNode;
import org.quill.compiler.frontend.parser.ast.ConditionalBranch;
import org.quill.compiler.frontend.parser.ast.ConditionalNode;

import java.util.List;

/**
 * Handles {@code else if expr}, which adds a branch to the conditional chain directly above it.
 */
public class ElseIfKeywordHandler implements IKeywordHandler {

    @Override
    public ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException {
        AstNode previous = context.previousSibling();
        if (!(previous instanceof ConditionalNode conditional) || conditional.elseBody() != null) {
            throw new TemplateSyntaxException(CompilerErrorCode.ELSE_WITHOUT_IF,
                    "'else if' without a preceding 'if' at the same depth", keyword.source(), null);
        }
        Token predicate = context.consume(TokenType.ARGUMENT, "a condition");
        ConditionalNode extended = conditional.withBranch(
                new ConditionalBranch(predicate.stringValue(), false, List.of(), keyword.source()));
        int index = extended.branches().size() - 1;
        return ParsedLine.chained(extended, (current, children) -> ((ConditionalNode) current).withBranchBody(index, children));
    }
}
