package org.quill.compiler.api;

import org.quill.compiler.eval.VariableEnvironment;

/**
 * Defines the public, clean interface for the Quill template compiler.
 */
public interface ITemplateCompiler {

    /**
     * Compiles a template read through the configured file loader.
     *
     * @param templatePath The path of the entry template, resolved by the file loader.
     * @param environment The variables visible to the template's expressions.
     * @return A {@link RenderArtifact} containing the HTML and associated metadata.
     * @throws CompilationException if any stage fails.
     */
    RenderArtifact compileFile(String templatePath, VariableEnvironment environment) throws CompilationException;

    /**
     * Compiles template source held in memory. Relative {@code extends} and {@code include}
     * references are resolved against {@code templateName}.
     *
     * @param source The template source text.
     * @param templateName The logical file name used for diagnostics and path resolution.
     * @param environment The variables visible to the template's expressions.
     * @return A {@link RenderArtifact} containing the HTML and associated metadata.
     * @throws CompilationException if any stage fails.
     */
    RenderArtifact compileSource(String source, String templateName, VariableEnvironment environment) throws CompilationException;

    /**
     * Compiles template source and returns just the HTML.
     *
     * @param source The template source text.
     * @param environment The variables visible to the template's expressions.
     * @return The rendered HTML.
     * @throws CompilationException if any stage fails.
     */
    default String render(String source, VariableEnvironment environment) throws CompilationException {
        return compileSource(source, "<memory>", environment).html();
    }
}
