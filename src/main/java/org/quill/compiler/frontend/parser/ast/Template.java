package org.quill.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The parse result of one template file.
 *
 * @param fileName The canonical name of the file.
 * @param extendsNode The {@code extends} reference, or null.
 * @param nodes The top-level nodes, without the {@code extends} node.
 */
public record Template(String fileName, ExtendsNode extendsNode, List<AstNode> nodes) {

    public Template {
        nodes = List.copyOf(nodes);
    }
}
