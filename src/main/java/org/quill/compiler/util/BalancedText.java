package org.quill.compiler.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Scanning helpers for text that embeds expressions. Quotes ({@code ' " `}) and the
 * bracket pairs {@code () [] {}} are balanced, so delimiters inside string literals or
 * nested calls never end a span early.
 */
public final class BalancedText {

    private BalancedText() {}

    /**
     * Finds the delimiter that closes a span.
     *
     * @param text The text to scan.
     * @param from The index of the first character inside the span.
     * @param close The closing delimiter, one of {@code ) ] }}.
     * @return The index of the closing delimiter, or -1 if the span is never closed or
     *         a mismatched bracket is found first.
     */
    public static int findClosing(CharSequence text, int from, char close) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    return c == close ? i : -1;
                }
                depth--;
            }
        }
        return -1;
    }

    /**
     * Splits text on a separator that appears outside of quotes and brackets.
     * Parts are trimmed; an all-blank input yields an empty list.
     *
     * @param text The text to split.
     * @param separator The separator character.
     * @return The trimmed parts, in order.
     */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        if (text.isBlank()) {
            return parts;
        }
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(text.substring(start).trim());
        return parts;
    }

    /**
     * Finds the first top-level occurrence of a single {@code =} that is not part of
     * {@code ==}, {@code !=}, {@code <=}, {@code >=} or {@code =>}.
     *
     * @param text The text to scan.
     * @return The index of the assignment sign, or -1.
     */
    public static int indexOfAssignment(String text) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == '=' && depth == 0) {
                char before = i > 0 ? text.charAt(i - 1) : 0;
                char after = i + 1 < text.length() ? text.charAt(i + 1) : 0;
                if (after != '=' && after != '>' && before != '=' && before != '!' && before != '<' && before != '>') {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Checks whether the whole text is one quoted string literal.
     *
     * @param text The trimmed text.
     * @return {@code true} if the text starts with a quote whose matching quote is the last character.
     */
    public static boolean isSingleQuotedLiteral(String text) {
        if (text.length() < 2) {
            return false;
        }
        char quote = text.charAt(0);
        if (quote != '"' && quote != '\'' && quote != '`') {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == quote) {
                return i == text.length() - 1;
            }
        }
        return false;
    }

    /**
     * Removes the quotes of a string literal and resolves backslash escapes of quotes
     * and backslashes.
     *
     * @param literal A text for which {@link #isSingleQuotedLiteral(String)} holds.
     * @return The literal's content.
     */
    public static String unquote(String literal) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < literal.length() - 1; i++) {
            char c = literal.charAt(i);
            if (c == '\\' && i + 1 < literal.length() - 1) {
                char next = literal.charAt(i + 1);
                if (next == '\\' || next == '"' || next == '\'' || next == '`') {
                    sb.append(next);
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
