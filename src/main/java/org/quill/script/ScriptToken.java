package org.quill.script;

/**
 * A token of an expression.
 * @param type The kind of token.
 * @param text The raw text.
 * @param value The decoded literal value (a {@link Double} or {@link String}), or null.
 * @param position The zero-based offset in the expression.
 */
public record ScriptToken(ScriptTokenType type, String text, Object value, int position) {
}
