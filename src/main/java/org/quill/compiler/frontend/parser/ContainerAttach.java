package org.quill.compiler.frontend.parser;

import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Attaches the lines parsed below a construct to that construct once its indentation
 * frame closes.
 */
@FunctionalInterface
public interface ContainerAttach {

    /**
     * @param current The node as it currently stands in its parent.
     * @param children The nodes parsed at the deeper depth.
     * @return The node that replaces {@code current}.
     * @throws TemplateSyntaxException if the children are not valid content of the node.
     */
    AstNode attach(AstNode current, List<AstNode> children) throws TemplateSyntaxException;
}
