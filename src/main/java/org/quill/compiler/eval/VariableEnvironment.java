package org.quill.compiler.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The caller-supplied variables of a compile. Hosts fill it before compiling; the
 * compiler only ever reads a {@link #snapshot()}, so an environment can be reused for
 * further compiles but must not be written while another thread is snapshotting it.
 */
public class VariableEnvironment {

    private final Map<String, Value> variables;

    public VariableEnvironment() {
        this(new LinkedHashMap<>());
    }

    private VariableEnvironment(Map<String, Value> variables) {
        this.variables = variables;
    }

    /**
     * Creates an environment from plain Java data.
     * @param variables Names to values; values are converted with {@link Value#of(Object)}.
     * @return The new environment.
     */
    public static VariableEnvironment of(Map<String, ?> variables) {
        VariableEnvironment environment = new VariableEnvironment();
        variables.forEach(environment::set);
        return environment;
    }

    /**
     * Sets a variable.
     * @param name The variable name.
     * @param value The value.
     * @return This environment, for chaining.
     */
    public VariableEnvironment set(String name, Value value) {
        variables.put(name, value == null ? Value.NULL : value);
        return this;
    }

    /**
     * Sets a variable from plain Java data.
     * @param name The variable name.
     * @param value The value, converted with {@link Value#of(Object)}.
     * @return This environment, for chaining.
     */
    public VariableEnvironment set(String name, Object value) {
        return set(name, Value.of(value));
    }

    /**
     * @return An immutable copy of the current variables.
     */
    public VariableEnvironment snapshot() {
        return new VariableEnvironment(Collections.unmodifiableMap(new LinkedHashMap<>(variables)));
    }

    Map<String, Value> asMap() {
        return variables;
    }
}
