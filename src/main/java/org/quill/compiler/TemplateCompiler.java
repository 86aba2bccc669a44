package org.quill.compiler;

import org.quill.compiler.api.CompilationException;
import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.IFileLoader;
import org.quill.compiler.api.ITemplateCompiler;
import org.quill.compiler.api.LinkException;
import org.quill.compiler.api.RenderArtifact;
import org.quill.compiler.backend.emit.HtmlRenderer;
import org.quill.compiler.backend.expand.MixinExpander;
import org.quill.compiler.backend.link.TemplateLinker;
import org.quill.compiler.cache.TemplateCache;
import org.quill.compiler.diagnostics.DiagnosticsEngine;
import org.quill.compiler.eval.IExpressionEvaluator;
import org.quill.compiler.eval.VariableEnvironment;
import org.quill.compiler.frontend.ITemplateParser;
import org.quill.compiler.frontend.TemplateParser;
import org.quill.compiler.frontend.parser.ast.AstNode;
import org.quill.compiler.frontend.parser.ast.Template;
import org.quill.script.ScriptEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from template
 * source to HTML: parse, link, expand mixins, render.
 * <p>
 * Every compile builds its own stage instances, diagnostics and environment snapshot, so
 * one instance can be shared between threads. A compile is atomic: the first error
 * aborts it and no partial output is returned.
 */
public class TemplateCompiler implements ITemplateCompiler {

    private static final Logger log = LoggerFactory.getLogger(TemplateCompiler.class);

    private final IFileLoader fileLoader;
    private final IExpressionEvaluator evaluator;
    private final CompileOptions options;
    private final ITemplateParser parser;

    /**
     * Creates a compiler with the built-in expression evaluator and the configured defaults.
     * @param fileLoader The loader for entry templates and their references.
     */
    public TemplateCompiler(IFileLoader fileLoader) {
        this(fileLoader, CompileOptions.defaults());
    }

    /**
     * Creates a compiler with the built-in expression evaluator.
     * @param fileLoader The loader for entry templates and their references.
     * @param options The compiler settings.
     */
    public TemplateCompiler(IFileLoader fileLoader, CompileOptions options) {
        this(fileLoader, new ScriptEvaluator(options.expressionCacheMaxEntries()), options);
    }

    /**
     * Creates a compiler. A template cache is put in front of the parser unless
     * {@link CompileOptions#cacheMaxEntries()} is 0.
     * @param fileLoader The loader for entry templates and their references.
     * @param evaluator The evaluator for embedded expressions.
     * @param options The compiler settings.
     */
    public TemplateCompiler(IFileLoader fileLoader, IExpressionEvaluator evaluator, CompileOptions options) {
        this(fileLoader, evaluator, options, options.cacheMaxEntries() > 0
                ? new TemplateCache(new TemplateParser(), options.cacheMaxEntries())
                : new TemplateParser());
    }

    /**
     * Creates a compiler with an explicit parse step.
     * @param fileLoader The loader for entry templates and their references.
     * @param evaluator The evaluator for embedded expressions.
     * @param options The compiler settings.
     * @param parser The parser for every template file.
     */
    public TemplateCompiler(IFileLoader fileLoader, IExpressionEvaluator evaluator, CompileOptions options, ITemplateParser parser) {
        this.fileLoader = fileLoader;
        this.evaluator = evaluator;
        this.options = options;
        this.parser = parser;
    }

    @Override
    public RenderArtifact compileFile(String templatePath, VariableEnvironment environment) throws CompilationException {
        String path = fileLoader.resolve(templatePath, null);
        byte[] bytes;
        try {
            bytes = fileLoader.read(path);
        } catch (NoSuchFileException | FileNotFoundException e) {
            throw new LinkException(CompilerErrorCode.TEMPLATE_NOT_FOUND, "Template not found: " + path, null, e);
        } catch (IOException e) {
            throw new LinkException(CompilerErrorCode.IO_ERROR_READING_FILE,
                    "Could not read " + path + ": " + e.getMessage(), null, e);
        }
        return compile(new String(bytes, StandardCharsets.UTF_8), path, environment);
    }

    @Override
    public RenderArtifact compileSource(String source, String templateName, VariableEnvironment environment) throws CompilationException {
        return compile(source, templateName, environment);
    }

    /**
     * @return The settings of this compiler.
     */
    public CompileOptions getOptions() {
        return options;
    }

    private RenderArtifact compile(String source, String templateName, VariableEnvironment environment) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        VariableEnvironment snapshot = environment != null ? environment.snapshot() : new VariableEnvironment();
        long start = System.nanoTime();

        // Phase 1: Parsing
        Template template = parser.parse(source, templateName);
        long parsed = System.nanoTime();

        // Phase 2: Linking (extends, includes)
        TemplateLinker linker = new TemplateLinker(fileLoader, parser, diagnostics, options.templateExtension());
        List<AstNode> linked = linker.link(template);
        long linkedAt = System.nanoTime();

        // Phase 3: Mixin expansion
        List<AstNode> expanded = new MixinExpander(options.mixinRecursionLimit(), diagnostics).expand(linked);
        long expandedAt = System.nanoTime();

        // Phase 4: Rendering
        String html = new HtmlRenderer(evaluator, options.mode(), options.indent()).render(expanded, snapshot);
        long rendered = System.nanoTime();

        if (log.isDebugEnabled()) {
            log.debug("Compiled {}: parse {} us, link {} us, expand {} us, render {} us, {} file(s), {} diagnostic(s)",
                    templateName, (parsed - start) / 1000, (linkedAt - parsed) / 1000, (expandedAt - linkedAt) / 1000,
                    (rendered - expandedAt) / 1000, linker.getLoadedFiles().size(), diagnostics.getDiagnostics().size());
        }
        return new RenderArtifact(templateName, html, linker.getLoadedFiles(), diagnostics.getDiagnostics());
    }
}
