package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

/**
 * A bare {@code block} inside a mixin body, marking where the caller's block goes.
 *
 * @param source The position of the keyword.
 */
public record BlockSlotNode(SourceInfo source) implements AstNode {
}
