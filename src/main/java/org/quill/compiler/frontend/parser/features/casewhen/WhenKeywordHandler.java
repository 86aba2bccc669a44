package org.quill.compiler.frontend.parser.features.casewhen;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;
import org.quill.compiler.frontend.parser.ast.CaseNode;
import org.quill.compiler.frontend.parser.ast.WhenNode;
import org.quill.compiler.util.BalancedText;

import java.util.List;

/**
 * Handles {@code when v1, v2}. A clause without content falls through to the next one.
 */
public class WhenKeywordHandler implements IKeywordHandler {

    @Override
    public ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException {
        if (!(context.enclosingNode() instanceof CaseNode)) {
            throw new TemplateSyntaxException(CompilerErrorCode.WHEN_OUTSIDE_CASE,
                    "'when' outside of 'case'", keyword.source(), null);
        }
        Token values = context.consume(TokenType.ARGUMENT, "one or more values");
        List<String> parts = BalancedText.splitTopLevel(values.stringValue(), ',');
        if (parts.stream().anyMatch(String::isEmpty)) {
            throw new TemplateSyntaxException(CompilerErrorCode.MISSING_ARGUMENT,
                    "Empty value in 'when' list", values.source(), "a value");
        }
        WhenNode node = new WhenNode(parts, List.of(), keyword.source());
        return ParsedLine.container(node, (current, children) -> ((WhenNode) current).withBody(children));
    }
}
