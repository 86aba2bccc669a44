package org.quill.compiler.api;

/**
 * Raised by the tokenizer and the parser for malformed template source.
 */
public class TemplateSyntaxException extends CompilationException {

    private final String expected;

    /**
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The position of the offending input.
     * @param expected A short description of the construct that was expected there, may be null.
     */
    public TemplateSyntaxException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo, String expected) {
        super(errorCode, expected != null ? message + " (expected " + expected + ")" : message, sourceInfo);
        this.expected = expected;
    }

    /**
     * @return The construct the parser expected, or null.
     */
    public String getExpected() {
        return expected;
    }
}
