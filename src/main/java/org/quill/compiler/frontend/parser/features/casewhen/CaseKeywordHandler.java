package org.quill.compiler.frontend.parser.features.casewhen;

import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;
import org.quill.compiler.frontend.parser.ast.CaseClause;
import org.quill.compiler.frontend.parser.ast.CaseNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Handles {@code case expr}. Its deeper lines are restricted to {@code when} and
 * {@code default} clauses by the parser; silent comments between them are dropped.
 */
public class CaseKeywordHandler implements IKeywordHandler {

    @Override
    public ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException {
        Token subject = context.consume(TokenType.ARGUMENT, "an expression");
        CaseNode node = new CaseNode(subject.stringValue(), List.of(), keyword.source());
        return ParsedLine.container(node, (current, children) -> {
            List<CaseClause> clauses = children.stream()
                    .filter(CaseClause.class::isInstance)
                    .map(CaseClause.class::cast)
                    .collect(Collectors.toList());
            return new CaseNode(((CaseNode) current).subject(), clauses, current.source());
        });
    }
}
