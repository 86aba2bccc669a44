package org.quill.compiler.frontend.parser.features.conditional;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;
import org.quill.compiler.frontend.parser.ast.AstNode;
import org.quill.compiler.frontend.parser.ast.ConditionalNode;
import org.quill.compiler.frontend.parser.ast.EachNode;

import java.util.List;

/**
 * Handles {@code else}. It closes the conditional chain above it, or becomes the
 * else body of an {@code each} directly above it.
 */
public class ElseKeywordHandler implements IKeywordHandler {

    @Override
    public ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException {
        if (context.check(TokenType.ARGUMENT)) {
            Token extra = context.peek();
            throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_STATEMENT,
                    "Unexpected '" + extra.text() + "' after 'else'", extra.source(), "'else if' or end of line");
        }
        AstNode previous = context.previousSibling();
        if (previous instanceof ConditionalNode conditional && conditional.elseBody() == null) {
            return ParsedLine.chained(conditional.withElse(List.of()),
                    (current, children) -> ((ConditionalNode) current).withElse(children));
        }
        if (previous instanceof EachNode each && each.elseBody() == null) {
            return ParsedLine.chained(each.withElse(List.of()),
                    (current, children) -> ((EachNode) current).withElse(children));
        }
        throw new TemplateSyntaxException(CompilerErrorCode.ELSE_WITHOUT_IF,
                "'else' without a preceding 'if' or 'each' at the same depth", keyword.source(), null);
    }
}
