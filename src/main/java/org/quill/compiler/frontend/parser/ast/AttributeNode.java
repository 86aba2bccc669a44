package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

/**
 * One entry of an attribute list.
 *
 * @param name The attribute name.
 * @param value The value.
 * @param escaped {@code false} for {@code name!=expr}.
 * @param source The position of the entry.
 */
public record AttributeNode(String name, AttributeValue value, boolean escaped, SourceInfo source) {
}
