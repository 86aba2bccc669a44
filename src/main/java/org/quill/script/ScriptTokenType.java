package org.quill.script;

/**
 * Token kinds of the expression language.
 */
public enum ScriptTokenType {
    // Literals and names
    NUMBER, STRING, IDENTIFIER,
    TRUE, FALSE, NULL, UNDEFINED, TYPEOF,

    // Punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE,
    COMMA, COLON, DOT, QUESTION_DOT, QUESTION, QUESTION_QUESTION,

    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT, BANG,
    EQUAL_EQUAL, BANG_EQUAL, EQUAL_EQUAL_EQUAL, BANG_EQUAL_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    AND_AND, OR_OR,

    END
}
