package org.quill.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The binding of one mixin parameter for one expansion.
 *
 * @param name The parameter name.
 * @param kind Where the bound value comes from.
 * @param expressions The argument or default expression, or the rest arguments; empty when undefined.
 */
public record ParameterBinding(String name, Kind kind, List<String> expressions) {

    /**
     * The source of a bound value.
     */
    public enum Kind {
        /** A positional argument, evaluated in the caller's scope. */
        ARGUMENT,
        /** The declared default, evaluated in the mixin's own scope. */
        DEFAULT,
        /** Neither argument nor default; the parameter is undefined. */
        UNDEFINED,
        /** The remaining arguments collected into a list. */
        REST
    }

    public ParameterBinding {
        expressions = List.copyOf(expressions);
    }

    public static ParameterBinding argument(String name, String expression) {
        return new ParameterBinding(name, Kind.ARGUMENT, List.of(expression));
    }

    public static ParameterBinding defaulted(String name, String expression) {
        return new ParameterBinding(name, Kind.DEFAULT, List.of(expression));
    }

    public static ParameterBinding undefined(String name) {
        return new ParameterBinding(name, Kind.UNDEFINED, List.of());
    }

    public static ParameterBinding rest(String name, List<String> expressions) {
        return new ParameterBinding(name, Kind.REST, expressions);
    }
}
