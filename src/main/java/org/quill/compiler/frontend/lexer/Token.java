package org.quill.compiler.frontend.lexer;

import org.quill.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the template source by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., TAG, CLASS, KEYWORD).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (e.g., the expression inside an interpolation).
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name of the template the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
    /**
     * @return The position of this token.
     */
    public SourceInfo source() {
        return new SourceInfo(fileName, line, column);
    }

    /**
     * @return The processed value as a string, or the raw text if there is none.
     */
    public String stringValue() {
        return value != null ? value.toString() : text;
    }
}
