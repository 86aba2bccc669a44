package org.quill.script;

import org.quill.compiler.eval.Value;

import java.util.List;
import java.util.Map;

/**
 * Parsed expression tree. Nodes are immutable and shared between evaluations.
 */
public sealed interface ScriptNode {

    record Literal(Value value) implements ScriptNode {}

    record Variable(String name) implements ScriptNode {}

    /**
     * {@code target.name}, or {@code target?.name} when optional.
     */
    record Member(ScriptNode target, String name, boolean optional) implements ScriptNode {}

    /**
     * {@code target[index]}, or {@code target?.[index]} when optional.
     */
    record Index(ScriptNode target, ScriptNode index, boolean optional) implements ScriptNode {}

    /**
     * A method call {@code target.method(args)}.
     */
    record Call(ScriptNode target, String method, List<ScriptNode> arguments, boolean optional) implements ScriptNode {}

    record ArrayLiteral(List<ScriptNode> elements) implements ScriptNode {}

    /**
     * @param entries The entries in source order.
     */
    record ObjectLiteral(Map<String, ScriptNode> entries) implements ScriptNode {}

    record Unary(ScriptTokenType operator, ScriptNode operand) implements ScriptNode {}

    record Binary(ScriptTokenType operator, ScriptNode left, ScriptNode right) implements ScriptNode {}

    /**
     * {@code &&}, {@code ||} and {@code ??}; the right operand is only evaluated when needed.
     */
    record Logical(ScriptTokenType operator, ScriptNode left, ScriptNode right) implements ScriptNode {}

    record Conditional(ScriptNode condition, ScriptNode whenTrue, ScriptNode whenFalse) implements ScriptNode {}
}
