package org.quill.compiler.eval;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A chain of name bindings consulted by the expression evaluator. The root scope wraps
 * the read-only variable environment; loops and mixin expansions push child scopes
 * that are discarded when they end, so their bindings never leak to siblings.
 */
public final class Scope {

    private final Scope parent;
    private final Map<String, Value> bindings;

    private Scope(Scope parent, Map<String, Value> bindings) {
        this.parent = parent;
        this.bindings = bindings;
    }

    /**
     * Creates the root scope of a compile.
     * @param environment The environment snapshot.
     * @return The root scope.
     */
    public static Scope root(VariableEnvironment environment) {
        return new Scope(null, environment.asMap());
    }

    /**
     * Creates a child scope with no bindings.
     * @return The new scope.
     */
    public Scope child() {
        return new Scope(this, new LinkedHashMap<>());
    }

    /**
     * Binds a name in this scope, shadowing bindings of outer scopes.
     * @param name The name.
     * @param value The value.
     * @throws IllegalStateException if called on the root scope.
     */
    public void bind(String name, Value value) {
        if (parent == null) {
            throw new IllegalStateException("The root scope is read-only");
        }
        bindings.put(name, value);
    }

    /**
     * Looks a name up, innermost scope first.
     * @param name The name.
     * @return The bound value, or empty if no scope binds the name.
     */
    public Optional<Value> lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            Value value = scope.bindings.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * @param name The name.
     * @return Whether any scope of the chain binds the name.
     */
    public boolean isDefined(String name) {
        return lookup(name).isPresent();
    }
}
