package org.quill.compiler.api;

/**
 * Raised by the mixin expander for unknown mixins and runaway recursion.
 */
public class ExpansionException extends CompilationException {

    public ExpansionException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(errorCode, message, sourceInfo);
    }
}
