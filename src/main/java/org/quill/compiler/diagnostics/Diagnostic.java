package org.quill.compiler.diagnostics;

import org.quill.compiler.api.SourceInfo;

/**
 * Represents a single non-fatal diagnostic message that occurs during compilation.
 * Fatal problems are raised as exceptions and never recorded here.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param source The position the message refers to, may be null.
 */
public record Diagnostic(
        Type type,
        String message,
        SourceInfo source
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** Something that compiled but probably does not do what the author meant. */
        WARNING
    }

    @Override
    public String toString() {
        if (source == null) {
            return String.format("[%s] %s", type, message);
        }
        return String.format("[%s] %s:%d: %s", type, source.fileName(), source.lineNumber(), message);
    }
}
