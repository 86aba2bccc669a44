package org.quill.compiler.frontend.parser.features.casewhen;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;
import org.quill.compiler.frontend.parser.ast.CaseNode;
import org.quill.compiler.frontend.parser.ast.DefaultNode;

import java.util.List;

/**
 * Handles the {@code default} clause of a case.
 */
public class DefaultKeywordHandler implements IKeywordHandler {

    @Override
    public ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException {
        if (!(context.enclosingNode() instanceof CaseNode)) {
            throw new TemplateSyntaxException(CompilerErrorCode.WHEN_OUTSIDE_CASE,
                    "'default' outside of 'case'", keyword.source(), null);
        }
        if (context.check(TokenType.ARGUMENT)) {
            Token extra = context.peek();
            throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_STATEMENT,
                    "Unexpected '" + extra.text() + "' after 'default'", extra.source(), "end of line");
        }
        DefaultNode node = new DefaultNode(List.of(), keyword.source());
        return ParsedLine.container(node, (current, children) -> ((DefaultNode) current).withBody(children));
    }
}
