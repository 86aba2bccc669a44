package org.quill.compiler.frontend.parser;

import org.quill.compiler.api.SourceInfo;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ast.AstNode;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides keyword handlers with access to the token stream of the current line and
 * to the surrounding structure without coupling them to the parser implementation.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param expected A description of the expected construct, used in the error.
     * @return The consumed token.
     * @throws TemplateSyntaxException if the token type does not match.
     */
    Token consume(TokenType type, String expected) throws TemplateSyntaxException;

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    // Structural queries

    /**
     * @return The logical name of the file being parsed.
     */
    String fileName();

    /**
     * @return The indentation depth of the current line.
     */
    int currentDepth();

    /**
     * @return The last node added at the current depth under the same parent, or null.
     */
    AstNode previousSibling();

    /**
     * @return The node whose content is currently being parsed, or null at the top level.
     */
    AstNode enclosingNode();

    /**
     * @return Whether the current line lies inside a mixin definition.
     */
    boolean insideMixinDefinition();

    /**
     * @return Whether anything other than silent comments has been parsed so far.
     */
    boolean hasContent();

    /**
     * Records a block declaration of this file.
     * @param name The block name.
     * @param source The position of the declaration.
     * @throws TemplateSyntaxException if the file already declares a block of that name.
     */
    void declareBlock(String name, SourceInfo source) throws TemplateSyntaxException;
}
