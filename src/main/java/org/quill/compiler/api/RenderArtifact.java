package org.quill.compiler.api;

import org.quill.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The complete output of one compile.
 *
 * @param templateName The name of the entry template.
 * @param html The rendered HTML.
 * @param sourceFiles Every file that took part in the compile, in load order.
 * @param diagnostics Non-fatal diagnostics collected during the compile.
 */
public record RenderArtifact(
        String templateName,
        String html,
        List<String> sourceFiles,
        List<Diagnostic> diagnostics
) {
    public RenderArtifact {
        sourceFiles = sourceFiles != null ? List.copyOf(sourceFiles) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }
}
