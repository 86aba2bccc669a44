package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A run of text.
 *
 * @param segments Literal and expression segments in order.
 * @param escaped Whether literal segments are HTML-escaped on output. Template text and
 *                raw includes keep their literals verbatim.
 * @param source The position of the text.
 */
public record TextNode(List<TextSegment> segments, boolean escaped, SourceInfo source) implements AstNode {

    public TextNode {
        segments = List.copyOf(segments);
    }

    /**
     * Creates a verbatim text node with a single literal.
     * @param text The text.
     * @param source The position.
     * @return The node.
     */
    public static TextNode literal(String text, SourceInfo source) {
        return new TextNode(List.of(new TextSegment.Literal(text)), false, source);
    }

    /**
     * Joins this text with a following run, separated by a newline.
     * @param next The following text.
     * @return The merged node, positioned at this node.
     */
    public TextNode joinLine(TextNode next) {
        List<TextSegment> merged = new ArrayList<>(segments);
        merged.add(new TextSegment.Literal("\n"));
        merged.addAll(next.segments());
        return new TextNode(merged, escaped, source);
    }
}
