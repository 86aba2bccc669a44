package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

/**
 * A piece of a text run.
 */
public sealed interface TextSegment permits TextSegment.Literal, TextSegment.ExpressionSpan {

    /**
     * Text emitted as written.
     * @param text The text.
     */
    record Literal(String text) implements TextSegment {}

    /**
     * An embedded expression.
     * @param expression The expression source.
     * @param escaped Whether the value is HTML-escaped ({@code #{}} and {@code =}) or not ({@code !{}} and {@code !=}).
     * @param source The position of the span.
     */
    record ExpressionSpan(String expression, boolean escaped, SourceInfo source) implements TextSegment {}
}
