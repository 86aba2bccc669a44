package org.quill.compiler.frontend.directive;

import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;

/**
 * The base interface for all keyword handlers.
 * Each handler is responsible for one keyword line (e.g., {@code if}, {@code mixin}).
 */
public interface IKeywordHandler {

    /**
     * Parses the rest of a keyword line. The keyword token has already been consumed;
     * the handler consumes the tokens up to, but not including, the line's NEWLINE.
     *
     * @param keyword The keyword token.
     * @param context The context that provides access to the token stream and the surrounding structure.
     * @return The node for this line and how its deeper lines attach.
     * @throws TemplateSyntaxException if the line is malformed or misplaced.
     */
    ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException;
}
