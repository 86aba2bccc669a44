package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;

/**
 * An {@code include} reference.
 *
 * @param targetPath The path of the included file as written.
 * @param filter The filter name of {@code include:filter}, or null.
 * @param source The position of the keyword.
 */
public record IncludeNode(String targetPath, String filter, SourceInfo source) implements AstNode {
}
