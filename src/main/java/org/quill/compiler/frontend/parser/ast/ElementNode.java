package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

import java.util.List;

/**
 * An HTML element.
 *
 * @param name The tag name.
 * @param classes The shorthand classes, in first-seen order without duplicates.
 * @param id The {@code #id} shorthand, or null.
 * @param attributes The attribute list entries in source order.
 * @param children The content of the element.
 * @param selfClosing Whether the tag was written with a trailing {@code /}.
 * @param source The position of the tag.
 */
public record ElementNode(
        String name,
        List<String> classes,
        String id,
        List<AttributeNode> attributes,
        List<AstNode> children,
        boolean selfClosing,
        SourceInfo source
) implements AstNode {

    public ElementNode {
        classes = List.copyOf(classes);
        attributes = List.copyOf(attributes);
        children = List.copyOf(children);
    }

    @Override
    public List<List<AstNode>> getBodies() {
        return List.of(children);
    }

    @Override
    public AstNode withBodies(List<List<AstNode>> bodies) {
        return withChildren(bodies.get(0));
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }

    public ElementNode withChildren(List<AstNode> newChildren) {
        return new ElementNode(name, classes, id, attributes, newChildren, selfClosing, source);
    }
}
