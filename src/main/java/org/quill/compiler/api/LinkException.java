package org.quill.compiler.api;

/**
 * Raised by the template linker: unknown blocks, include/extends cycles and missing files.
 */
public class LinkException extends CompilationException {

    public LinkException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(errorCode, message, sourceInfo);
    }

    public LinkException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo, Throwable cause) {
        super(errorCode, message, sourceInfo, cause);
    }
}
