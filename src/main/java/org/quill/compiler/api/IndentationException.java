package org.quill.compiler.api;

/**
 * Raised when a line's leading whitespace does not follow the indentation unit fixed
 * by the first indented line of the file.
 */
public class IndentationException extends TemplateSyntaxException {

    public IndentationException(String message, SourceInfo sourceInfo) {
        super(CompilerErrorCode.INCONSISTENT_INDENTATION, message, sourceInfo, null);
    }
}
