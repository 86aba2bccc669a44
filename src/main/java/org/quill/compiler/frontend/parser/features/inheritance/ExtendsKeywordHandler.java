package org.quill.compiler.frontend.parser.features.inheritance;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;
import org.quill.compiler.frontend.parser.ast.ExtendsNode;
import org.quill.compiler.frontend.parser.features.include.IncludeKeywordHandler;

/**
 * Handles {@code extends path}. Only silent comments may precede it, and it may appear once.
 */
public class ExtendsKeywordHandler implements IKeywordHandler {

    @Override
    public ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException {
        if (context.currentDepth() != 0 || context.hasContent()) {
            throw new TemplateSyntaxException(CompilerErrorCode.MISPLACED_EXTENDS,
                    "'extends' must be the first statement of a template", keyword.source(), null);
        }
        Token path = context.consume(TokenType.ARGUMENT, "a template path");
        return ParsedLine.leaf(new ExtendsNode(IncludeKeywordHandler.unquotePath(path.stringValue()), keyword.source()));
    }
}
