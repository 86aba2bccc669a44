package org.quill.compiler.api;

/**
 * Raised when an embedded expression cannot be evaluated, or when its value cannot be
 * used in the context it appears in.
 * <p>
 * Evaluators throw it without a position; the renderer re-throws it with the
 * {@link SourceInfo} of the expression.
 */
public class EvaluationException extends CompilationException {

    public EvaluationException(String message) {
        super(CompilerErrorCode.EXPRESSION_FAILED, message);
    }

    public EvaluationException(CompilerErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public EvaluationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo, Throwable cause) {
        super(errorCode, message, sourceInfo, cause);
    }
}
