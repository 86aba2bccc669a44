package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

/**
 * A doctype declaration.
 *
 * @param kind The doctype kind, {@code html} when omitted.
 * @param source The position of the keyword.
 */
public record DoctypeNode(String kind, SourceInfo source) implements AstNode {
}
