package org.quill.compiler.api;

/**
 * An exception that is thrown when an error occurs during the compilation process.
 * <p>
 * It is part of the public API. Each pipeline stage throws its own subtype; all of them
 * carry a {@link CompilerErrorCode} and, where known, the {@link SourceInfo} of the
 * offending construct.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final transient SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and source information.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The source information, may be null.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        this(errorCode, message, sourceInfo, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message, source information and cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The source information, may be null.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo, Throwable cause) {
        super(sourceInfo != null ? String.format("%s at %s", message, sourceInfo) : message, cause);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The error code of this failure.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The position of the offending construct, or null if unknown.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
