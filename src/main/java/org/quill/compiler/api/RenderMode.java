package org.quill.compiler.api;

/**
 * Output formatting. Both modes emit identical tags, attributes and text and differ
 * only in the newline/indentation whitespace inserted between structural emissions.
 */
public enum RenderMode {
    /** No whitespace is inserted. */
    COMPACT,
    /** Every structural emission starts on its own, indented line. */
    PRETTY
}
