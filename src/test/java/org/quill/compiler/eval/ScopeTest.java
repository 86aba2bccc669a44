package org.quill.compiler.eval;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link Scope} and {@link VariableEnvironment}.
 */
public class ScopeTest {

    /**
     * Verifies that child bindings shadow outer ones without changing them.
     * This is a unit test for scope lookup.
     */
    @Test
    @Tag("unit")
    void testShadowing() {
        // Arrange
        Scope root = Scope.root(VariableEnvironment.of(Map.of("x", 1, "y", "outer")));
        Scope child = root.child();

        // Act
        child.bind("y", Value.of("inner"));

        // Assert
        assertThat(child.lookup("y")).contains(Value.of("inner"));
        assertThat(child.lookup("x")).contains(Value.of(1.0));
        assertThat(root.lookup("y")).contains(Value.of("outer"));
        assertThat(child.isDefined("z")).isFalse();
    }

    /**
     * Verifies that the root scope cannot be written.
     * This is a unit test for scope lookup.
     */
    @Test
    @Tag("unit")
    void testRootIsReadOnly() {
        // Arrange
        Scope root = Scope.root(new VariableEnvironment());

        // Act & Assert
        assertThatThrownBy(() -> root.bind("x", Value.TRUE)).isInstanceOf(IllegalStateException.class);
    }

    /**
     * Verifies that a snapshot is unaffected by later changes to its source.
     * This is a unit test for the variable environment.
     */
    @Test
    @Tag("unit")
    void testSnapshotIsIsolated() {
        // Arrange
        VariableEnvironment environment = new VariableEnvironment().set("a", 1);
        VariableEnvironment snapshot = environment.snapshot();

        // Act
        environment.set("a", 2).set("b", 3);

        // Assert
        Scope scope = Scope.root(snapshot);
        assertThat(scope.lookup("a")).contains(Value.of(1.0));
        assertThat(scope.isDefined("b")).isFalse();
    }

    /**
     * Verifies that a null host value is stored as the null value and so counts as defined.
     * This is a unit test for the variable environment.
     */
    @Test
    @Tag("unit")
    void testNullIsDefined() {
        // Arrange
        Scope scope = Scope.root(new VariableEnvironment().set("n", (Object) null));

        // Assert
        assertThat(scope.lookup("n")).contains(Value.NULL);
    }
}
