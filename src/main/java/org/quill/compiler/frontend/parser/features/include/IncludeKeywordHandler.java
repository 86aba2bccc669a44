package org.quill.compiler.frontend.parser.features.include;

import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;
import org.quill.compiler.frontend.parser.ast.IncludeNode;
import org.quill.compiler.util.BalancedText;

/**
 * Handles {@code include path} and {@code include:filter path}.
 */
public class IncludeKeywordHandler implements IKeywordHandler {

    @Override
    public ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException {
        Token path = context.consume(TokenType.ARGUMENT, "a file path");
        String filter = keyword.value() != null ? keyword.value().toString() : null;
        return ParsedLine.leaf(new IncludeNode(unquotePath(path.stringValue()), filter, keyword.source()));
    }

    /**
     * Paths may be written bare or quoted.
     * @param path The path as written.
     * @return The path without surrounding quotes.
     */
    public static String unquotePath(String path) {
        return BalancedText.isSingleQuotedLiteral(path) ? BalancedText.unquote(path) : path;
    }
}
