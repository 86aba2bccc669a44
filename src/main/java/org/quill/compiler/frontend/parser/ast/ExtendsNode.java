package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

/**
 * An {@code extends} reference.
 *
 * @param targetPath The path of the parent template as written.
 * @param source The position of the keyword.
 */
public record ExtendsNode(String targetPath, SourceInfo source) implements AstNode {
}
