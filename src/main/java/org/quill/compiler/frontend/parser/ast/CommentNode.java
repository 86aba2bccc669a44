package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

/**
 * A comment.
 *
 * @param text The comment text, including swallowed block lines.
 * @param visible {@code true} for {@code //}, {@code false} for {@code //-}.
 * @param source The position of the comment.
 */
public record CommentNode(String text, boolean visible, SourceInfo source) implements AstNode {
}
