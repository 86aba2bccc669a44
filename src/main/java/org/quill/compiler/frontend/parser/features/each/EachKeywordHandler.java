package org.quill.compiler.frontend.parser.features.each;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;
import org.quill.compiler.frontend.parser.ast.EachNode;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles {@code each item[, index] in expr} and its alias {@code for}.
 */
public class EachKeywordHandler implements IKeywordHandler {

    private static final Pattern HEADER = Pattern.compile(
            "([A-Za-z_$][A-Za-z0-9_$]*)(?:\\s*,\\s*([A-Za-z_$][A-Za-z0-9_$]*))?\\s+in\\s+(.+)", Pattern.DOTALL);

    @Override
    public ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException {
        Token header = context.consume(TokenType.ARGUMENT, "'item in expression'");
        Matcher matcher = HEADER.matcher(header.stringValue());
        if (!matcher.matches()) {
            throw new TemplateSyntaxException(CompilerErrorCode.INVALID_EACH_SYNTAX,
                    "Malformed loop header '" + header.stringValue() + "'", header.source(), "'item[, index] in expression'");
        }
        EachNode node = new EachNode(matcher.group(1), matcher.group(2), matcher.group(3).trim(),
                List.of(), null, keyword.source());
        return ParsedLine.container(node, (current, children) -> ((EachNode) current).withBody(children));
    }
}
