package org.quill.compiler.diagnostics;

import org.quill.compiler.api.SourceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting the non-fatal diagnostics of a single compile.
 * <p>
 * This decouples reporting from the stage logic. Every reported warning is also
 * logged so hosts that never look at the artifact still see it.
 */
public class DiagnosticsEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param source  The position the warning refers to, may be null.
     */
    public void reportWarning(String message, SourceInfo source) {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.WARNING, message, source);
        diagnostics.add(diagnostic);
        log.warn("{}", diagnostic);
    }

    /**
     * Checks if warnings have been reported.
     *
     * @return {@code true} if at least one warning exists, otherwise {@code false}.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
