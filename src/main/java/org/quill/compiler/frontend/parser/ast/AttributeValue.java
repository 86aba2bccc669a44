package org.quill.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The value of an attribute list entry.
 */
public sealed interface AttributeValue permits AttributeValue.Expression, AttributeValue.Interpolated, AttributeValue.Flag {

    /**
     * An expression evaluated at render time.
     * @param expression The expression source.
     */
    record Expression(String expression) implements AttributeValue {}

    /**
     * A quoted string containing interpolation spans.
     * @param segments The literal and expression segments.
     */
    record Interpolated(List<TextSegment> segments) implements AttributeValue {
        public Interpolated {
            segments = List.copyOf(segments);
        }
    }

    /**
     * A bare attribute name, meaning {@code true}.
     */
    record Flag() implements AttributeValue {}
}
