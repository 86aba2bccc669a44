package org.quill.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Tokenizer & Parser Errors
    /** A character that cannot start or continue any construct. */
    UNEXPECTED_CHARACTER,
    /** A {@code #{} or {@code !{} span that is never closed. */
    UNTERMINATED_INTERPOLATION,
    /** An attribute list whose opening parenthesis is never closed. */
    UNBALANCED_ATTRIBUTES,
    /** Indentation that mixes characters or is not a multiple of the fixed unit. */
    INCONSISTENT_INDENTATION,
    /** A deeper line below a construct that cannot have children. */
    UNEXPECTED_INDENTATION,
    /** A line that does not start any known construct. */
    UNEXPECTED_STATEMENT,
    /** A keyword that requires an argument was written without one. */
    MISSING_ARGUMENT,
    /** An {@code else} without a matching {@code if} or {@code each} at the same depth. */
    ELSE_WITHOUT_IF,
    /** A {@code when} or {@code default} outside of a {@code case}. */
    WHEN_OUTSIDE_CASE,
    /** {@code extends} that is not the first construct, repeated, or nested. */
    MISPLACED_EXTENDS,
    /** Content next to {@code extends} that is not a block override or mixin. */
    INVALID_EXTENDS_CONTENT,
    /** The same block name declared twice in one file. */
    DUPLICATE_BLOCK,
    /** More than one {@code #id} shorthand on a single tag. */
    DUPLICATE_ID_SHORTHAND,
    /** A malformed attribute list entry. */
    INVALID_ATTRIBUTE,
    /** A malformed mixin definition or call. */
    INVALID_MIXIN_SIGNATURE,
    /** A malformed {@code each} header. */
    INVALID_EACH_SYNTAX,
    // endregion

    // region Linker Errors
    /** A block override that names a block no ancestor declares. */
    UNKNOWN_BLOCK,
    /** A file that transitively includes itself. */
    INCLUDE_CYCLE,
    /** A template that transitively extends itself. */
    EXTENDS_CYCLE,
    /** A referenced template that the file loader cannot find. */
    TEMPLATE_NOT_FOUND,
    // endregion

    // region Expansion Errors
    /** A call to a mixin that is defined nowhere. */
    UNKNOWN_MIXIN,
    /** Mixin expansion nested deeper than the configured limit. */
    MIXIN_RECURSION_LIMIT,
    // endregion

    // region Evaluation Errors
    /** The expression evaluator failed. */
    EXPRESSION_FAILED,
    /** A list or map value in a context that needs text. */
    UNPRINTABLE_VALUE,
    /** An {@code each} over a value that cannot be iterated. */
    NOT_ITERABLE,
    // endregion

    // region Render Errors
    /** Content given to a void or self-closing element. */
    INVALID_VOID_CONTENT,
    /** A node that should have been resolved before rendering. */
    UNEXPANDED_NODE,
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a file. */
    IO_ERROR_READING_FILE
    // endregion
}
