package org.quill.compiler.frontend.parser.ast;

/**
 * A declared mixin parameter.
 *
 * @param name The parameter name.
 * @param defaultExpr The default expression, or null.
 */
public record MixinParameter(String name, String defaultExpr) {
}
