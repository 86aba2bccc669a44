package org.quill.compiler.backend.link;

import org.quill.compiler.api.CompilationException;
import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.IFileLoader;
import org.quill.compiler.api.LinkException;
import org.quill.compiler.api.SourceInfo;
import org.quill.compiler.diagnostics.DiagnosticsEngine;
import org.quill.compiler.frontend.ITemplateParser;
import org.quill.compiler.frontend.TreeWalker;
import org.quill.compiler.frontend.parser.ast.AstNode;
import org.quill.compiler.frontend.parser.ast.BlockMode;
import org.quill.compiler.frontend.parser.ast.BlockNode;
import org.quill.compiler.frontend.parser.ast.CommentNode;
import org.quill.compiler.frontend.parser.ast.IncludeNode;
import org.quill.compiler.frontend.parser.ast.MixinDefNode;
import org.quill.compiler.frontend.parser.ast.Template;
import org.quill.compiler.frontend.parser.ast.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Linking pass: flattens multi-file composition into one node list.
 * <p>
 * Includes are spliced in place, depth-first. The {@code extends} chain is folded from
 * the root ancestor down to the requested template: the root ancestor's blocks give the
 * initial content of every block name, and each later level applies its overrides in
 * turn. The resolved content is finally substituted into the root ancestor's skeleton.
 * An instance links one compile and must not be shared.
 */
public class TemplateLinker {

    private static final Logger log = LoggerFactory.getLogger(TemplateLinker.class);

    private final IFileLoader fileLoader;
    private final ITemplateParser parser;
    private final DiagnosticsEngine diagnostics;
    private final String templateExtension;

    private final Deque<String> includeStack = new ArrayDeque<>();
    private final Set<String> loadedFiles = new LinkedHashSet<>();

    /**
     * Constructs a new linker.
     * @param fileLoader The loader that resolves and reads referenced files.
     * @param parser The parser for referenced templates.
     * @param diagnostics The engine for non-fatal diagnostics.
     * @param templateExtension The extension of template files, e.g. {@code .pug}; included
     *                          files with any other extension are spliced as raw text.
     */
    public TemplateLinker(IFileLoader fileLoader, ITemplateParser parser, DiagnosticsEngine diagnostics, String templateExtension) {
        this.fileLoader = fileLoader;
        this.parser = parser;
        this.diagnostics = diagnostics;
        this.templateExtension = templateExtension;
    }

    /**
     * Links a template.
     * @param root The requested template.
     * @return The flattened node list, without extends or include nodes.
     * @throws CompilationException if a referenced file is missing, unparsable or cyclic,
     *                              or a block override names an unknown block.
     */
    public List<AstNode> link(Template root) throws CompilationException {
        loadedFiles.add(root.fileName());
        return linkChain(root);
    }

    /**
     * @return Every file that took part in linking, in load order.
     */
    public List<String> getLoadedFiles() {
        return List.copyOf(loadedFiles);
    }

    private List<AstNode> linkChain(Template leaf) throws CompilationException {
        List<Template> chain = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        seen.add(leaf.fileName());
        chain.add(leaf);
        Template level = leaf;
        while (level.extendsNode() != null) {
            String path = fileLoader.resolve(level.extendsNode().targetPath(), level.fileName());
            if (!seen.add(path)) {
                throw new LinkException(CompilerErrorCode.EXTENDS_CYCLE,
                        "Template inheritance cycle: " + String.join(" -> ", seen) + " -> " + path,
                        level.extendsNode().source());
            }
            level = load(path, level.extendsNode().source());
            chain.add(level);
        }
        Collections.reverse(chain);

        Template rootAncestor = chain.get(0);
        List<AstNode> skeleton = spliceIncludes(rootAncestor);
        if (chain.size() == 1) {
            return skeleton;
        }

        Map<String, List<AstNode>> blocks = new LinkedHashMap<>();
        declareBlocks(skeleton, blocks);
        List<AstNode> hoistedMixins = new ArrayList<>();
        for (Template descendant : chain.subList(1, chain.size())) {
            for (AstNode node : spliceIncludes(descendant)) {
                if (node instanceof BlockNode block) {
                    applyOverride(block, blocks);
                } else if (node instanceof MixinDefNode) {
                    hoistedMixins.add(node);
                } else if (!(node instanceof CommentNode)) {
                    diagnostics.reportWarning("Content outside of blocks is ignored in a template that extends another",
                            node.source());
                }
            }
        }
        log.debug("Folded {} block(s) across {} levels for {}", blocks.size(), chain.size(), leaf.fileName());

        List<AstNode> result = new ArrayList<>(hoistedMixins);
        result.addAll(substitute(skeleton, blocks, new HashSet<>()));
        return result;
    }

    private void applyOverride(BlockNode override, Map<String, List<AstNode>> blocks) throws LinkException {
        List<AstNode> inherited = blocks.get(override.name());
        if (inherited == null) {
            throw new LinkException(CompilerErrorCode.UNKNOWN_BLOCK,
                    "Block '" + override.name() + "' is not declared by any parent template", override.source());
        }
        List<AstNode> resolved = new ArrayList<>();
        if (override.mode() == BlockMode.APPEND) {
            resolved.addAll(inherited);
            resolved.addAll(override.content());
        } else if (override.mode() == BlockMode.PREPEND) {
            resolved.addAll(override.content());
            resolved.addAll(inherited);
        } else {
            resolved.addAll(override.content());
        }
        blocks.put(override.name(), resolved);
        Map<String, List<AstNode>> nested = new LinkedHashMap<>();
        declareBlocks(override.content(), nested);
        nested.forEach(blocks::putIfAbsent);
    }

    private static void declareBlocks(List<AstNode> nodes, Map<String, List<AstNode>> blocks) {
        new TreeWalker(Map.of(BlockNode.class, node -> {
            BlockNode block = (BlockNode) node;
            blocks.putIfAbsent(block.name(), block.content());
        })).walk(nodes);
    }

    private static List<AstNode> substitute(List<AstNode> nodes, Map<String, List<AstNode>> blocks, Set<String> active) {
        return TreeWalker.rewrite(nodes, node -> {
            if (!(node instanceof BlockNode block)) {
                return null;
            }
            List<AstNode> content = active.contains(block.name())
                    ? block.content()
                    : blocks.getOrDefault(block.name(), block.content());
            active.add(block.name());
            List<AstNode> resolved = substitute(content, blocks, active);
            active.remove(block.name());
            return List.of(new BlockNode(block.name(), BlockMode.DEFAULT, resolved, block.source()));
        });
    }

    private List<AstNode> spliceIncludes(Template template) throws CompilationException {
        includeStack.push(template.fileName());
        try {
            return TreeWalker.rewrite(template.nodes(), node -> {
                if (node instanceof IncludeNode include) {
                    return resolveInclude(include, template.fileName());
                }
                return null;
            });
        } finally {
            includeStack.pop();
        }
    }

    private List<AstNode> resolveInclude(IncludeNode include, String fromFile) throws CompilationException {
        String path = fileLoader.resolve(include.targetPath(), fromFile);
        if (include.filter() != null || !path.endsWith(templateExtension)) {
            if (include.filter() != null) {
                diagnostics.reportWarning("Filter '" + include.filter() + "' is not executed; "
                        + path + " is included as raw text", include.source());
            }
            String raw = read(path, include.source());
            return List.of(TextNode.literal(raw, include.source()));
        }
        if (includeStack.contains(path)) {
            List<String> cycle = new ArrayList<>(includeStack);
            Collections.reverse(cycle);
            throw new LinkException(CompilerErrorCode.INCLUDE_CYCLE,
                    "Include cycle: " + String.join(" -> ", cycle) + " -> " + path,
                    include.source());
        }
        return linkChain(load(path, include.source()));
    }

    private Template load(String path, SourceInfo referencedFrom) throws CompilationException {
        return parser.parse(read(path, referencedFrom), path);
    }

    private String read(String path, SourceInfo referencedFrom) throws LinkException {
        try {
            byte[] bytes = fileLoader.read(path);
            loadedFiles.add(path);
            log.debug("Loaded {} ({} bytes)", path, bytes.length);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (NoSuchFileException | FileNotFoundException e) {
            throw new LinkException(CompilerErrorCode.TEMPLATE_NOT_FOUND, "Template not found: " + path, referencedFrom, e);
        } catch (IOException e) {
            throw new LinkException(CompilerErrorCode.IO_ERROR_READING_FILE,
                    "Could not read " + path + ": " + e.getMessage(), referencedFrom, e);
        }
    }
}
