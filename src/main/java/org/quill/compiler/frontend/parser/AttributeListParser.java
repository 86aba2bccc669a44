package org.quill.compiler.frontend.parser;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.SourceInfo;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.lexer.InterpolationScanner;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.parser.ast.AttributeNode;
import org.quill.compiler.frontend.parser.ast.AttributeValue;
import org.quill.compiler.frontend.parser.ast.TextSegment;
import org.quill.compiler.util.BalancedText;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the text of an attribute list into entries.
 * <p>
 * Entries are separated by commas or whitespace. A value ends at a top-level comma, or
 * at top-level whitespace unless an operator on either side of it continues the
 * expression ({@code a=x + 1 b=2} yields two entries).
 */
public final class AttributeListParser {

    private static final String OPERATOR_CHARS = "+-*/%<>=!&|?:.";

    private AttributeListParser() {}

    /**
     * @param token An {@code ATTRIBUTES} token.
     * @return The entries in source order.
     * @throws TemplateSyntaxException if an entry is malformed.
     */
    public static List<AttributeNode> parse(Token token) throws TemplateSyntaxException {
        String text = token.stringValue();
        SourceInfo source = token.source();
        List<AttributeNode> attributes = new ArrayList<>();
        int n = text.length();
        int i = 0;
        while (true) {
            while (i < n && (Character.isWhitespace(text.charAt(i)) || text.charAt(i) == ',')) i++;
            if (i >= n) {
                break;
            }
            String name;
            char first = text.charAt(i);
            if (first == '"' || first == '\'') {
                int end = text.indexOf(first, i + 1);
                if (end < 0) {
                    throw invalid("Unterminated attribute name", source);
                }
                name = text.substring(i + 1, end);
                i = end + 1;
            } else {
                int start = i;
                while (i < n && isNameChar(text.charAt(i))) i++;
                name = text.substring(start, i);
            }
            if (name.isEmpty()) {
                throw invalid("Unexpected character '" + text.charAt(i) + "' in attribute list", source);
            }
            int j = i;
            while (j < n && Character.isWhitespace(text.charAt(j))) j++;
            boolean escaped = true;
            if (text.startsWith("!=", j)) {
                escaped = false;
                i = j + 2;
            } else if (j < n && text.charAt(j) == '=') {
                i = j + 1;
            } else {
                attributes.add(new AttributeNode(name, new AttributeValue.Flag(), true, source));
                continue;
            }
            while (i < n && Character.isWhitespace(text.charAt(i))) i++;
            int end = valueEnd(text, i);
            String raw = text.substring(i, end).trim();
            if (raw.isEmpty()) {
                throw invalid("Missing value of attribute '" + name + "'", source);
            }
            attributes.add(new AttributeNode(name, toValue(raw, source), escaped, source));
            i = end;
        }
        return attributes;
    }

    private static AttributeValue toValue(String raw, SourceInfo source) throws TemplateSyntaxException {
        if (BalancedText.isSingleQuotedLiteral(raw) && (raw.contains("#{") || raw.contains("!{"))) {
            List<TextSegment> segments = new ArrayList<>();
            for (InterpolationScanner.Piece piece : InterpolationScanner.scan(BalancedText.unquote(raw), source)) {
                switch (piece.kind()) {
                    case LITERAL -> segments.add(new TextSegment.Literal(piece.text()));
                    case ESCAPED -> segments.add(new TextSegment.ExpressionSpan(piece.text(), true, source));
                    case RAW -> segments.add(new TextSegment.ExpressionSpan(piece.text(), false, source));
                }
            }
            return new AttributeValue.Interpolated(segments);
        }
        return new AttributeValue.Expression(raw);
    }

    private static int valueEnd(String text, int start) {
        int depth = 0;
        char quote = 0;
        int i = start;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                i++;
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (depth == 0 && c == ',') {
                return i;
            } else if (depth == 0 && Character.isWhitespace(c)) {
                int next = i;
                while (next < text.length() && Character.isWhitespace(text.charAt(next))) next++;
                if (next >= text.length()) {
                    return next;
                }
                char before = text.charAt(i - 1);
                char after = text.charAt(next);
                if (OPERATOR_CHARS.indexOf(before) < 0 && OPERATOR_CHARS.indexOf(after) < 0) {
                    return i;
                }
                i = next;
                continue;
            }
            i++;
        }
        return text.length();
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ':' || c == '@' || c == '.';
    }

    private static TemplateSyntaxException invalid(String message, SourceInfo source) {
        return new TemplateSyntaxException(CompilerErrorCode.INVALID_ATTRIBUTE, message, source, "'name=value'");
    }
}
