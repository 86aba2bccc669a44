package org.quill.compiler.api;

/**
 * Raised by the renderer for structurally impossible output.
 */
public class RenderException extends CompilationException {

    public RenderException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(errorCode, message, sourceInfo);
    }
}
