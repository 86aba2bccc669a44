package org.quill.compiler.frontend.lexer;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.api.SourceInfo;
import org.quill.compiler.util.BalancedText;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a run of text into literal pieces and {@code #{}} / {@code !{}} spans.
 * Used by the lexer for text lines and by the parser for quoted attribute values.
 */
public final class InterpolationScanner {

    /**
     * The kind of a piece.
     */
    public enum Kind {
        LITERAL,
        ESCAPED,
        RAW
    }

    /**
     * One piece of scanned text.
     *
     * @param kind The kind of the piece.
     * @param text The literal text, or the trimmed expression of a span.
     * @param offset The offset of the piece in the scanned text.
     */
    public record Piece(Kind kind, String text, int offset) {}

    private InterpolationScanner() {}

    /**
     * Scans text that lies on a single line.
     *
     * @param text The text.
     * @param origin The position of the first character of {@code text}.
     * @return The pieces in order; adjacent literals are merged.
     * @throws TemplateSyntaxException if a span is never closed.
     */
    public static List<Piece> scan(String text, SourceInfo origin) throws TemplateSyntaxException {
        List<Piece> pieces = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int literalStart = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && isSpanStart(text, i + 1)) {
                literal.append(text.charAt(i + 1)).append('{');
                i += 3;
                continue;
            }
            if (isSpanStart(text, i)) {
                int end = BalancedText.findClosing(text, i + 2, '}');
                if (end < 0) {
                    throw new TemplateSyntaxException(CompilerErrorCode.UNTERMINATED_INTERPOLATION,
                            "Unterminated interpolation",
                            new SourceInfo(origin.fileName(), origin.lineNumber(), origin.columnNumber() + i),
                            "'}'");
                }
                if (literal.length() > 0) {
                    pieces.add(new Piece(Kind.LITERAL, literal.toString(), literalStart));
                    literal.setLength(0);
                }
                pieces.add(new Piece(c == '#' ? Kind.ESCAPED : Kind.RAW, text.substring(i + 2, end).trim(), i));
                i = end + 1;
                literalStart = i;
                continue;
            }
            literal.append(c);
            i++;
        }
        if (literal.length() > 0) {
            pieces.add(new Piece(Kind.LITERAL, literal.toString(), literalStart));
        }
        return pieces;
    }

    private static boolean isSpanStart(String text, int i) {
        return i + 1 < text.length()
                && (text.charAt(i) == '#' || text.charAt(i) == '!')
                && text.charAt(i + 1) == '{';
    }
}
