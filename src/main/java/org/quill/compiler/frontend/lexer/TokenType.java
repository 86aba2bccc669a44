package org.quill.compiler.frontend.lexer;

/**
 * Defines all possible types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Tag heads
    TAG,
    CLASS,
    ID,
    /** A parenthesized list; the value holds the text between the parentheses. */
    ATTRIBUTES,
    SELF_CLOSE,

    // Text
    TEXT,
    INTERPOLATION,
    RAW_INTERPOLATION,
    BUFFERED_CODE,
    UNESCAPED_CODE,
    PIPE,

    // Statements
    /** The text is the keyword ({@code else if} for the two-word form); the value holds an include filter. */
    KEYWORD,
    /** The remainder of a keyword line. */
    ARGUMENT,
    MIXIN_CALL,
    DOCTYPE,
    COMMENT,
    SILENT_COMMENT,

    // Structure
    INDENT,
    DEDENT,
    NEWLINE,
    END_OF_FILE
}
