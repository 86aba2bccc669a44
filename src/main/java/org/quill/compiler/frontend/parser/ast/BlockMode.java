package org.quill.compiler.frontend.parser.ast;

/**
 * How a block declaration combines with the content inherited for the same name.
 */
public enum BlockMode {
    DEFAULT,
    APPEND,
    PREPEND,
    REPLACE
}
