package org.quill.script;

import org.quill.compiler.api.EvaluationException;
import org.quill.compiler.eval.Scope;
import org.quill.compiler.eval.Value;
import org.quill.compiler.eval.VariableEnvironment;
import org.quill.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ScriptEvaluator}.
 * Each test evaluates expressions against a scope with a user record, a list and a few scalars.
 */
@ExtendWith(LogWatchExtension.class)
public class ScriptEvaluatorTest {

    private ScriptEvaluator evaluator;
    private Scope scope;

    @BeforeEach
    void setUp() {
        evaluator = new ScriptEvaluator();
        VariableEnvironment environment = new VariableEnvironment()
                .set("user", Map.of("name", "Ada", "tags", List.of("admin", "dev")))
                .set("items", List.of(1, 2, 3))
                .set("title", "  Hello World  ")
                .set("count", 5)
                .set("none", (Object) null);
        scope = Scope.root(environment);
    }

    private Value eval(String expression) throws EvaluationException {
        return evaluator.evaluate(expression, scope);
    }

    private String text(String expression) throws EvaluationException {
        return ScriptInterpreter.toText(eval(expression));
    }

    /**
     * Verifies literals, including escapes in strings and exponent numbers.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testLiterals() throws Exception {
        // Assert
        assertThat(eval("42")).isEqualTo(Value.of(42.0));
        assertThat(eval("1.5e3")).isEqualTo(Value.of(1500.0));
        assertThat(eval("'it\\'s'")).isEqualTo(Value.of("it's"));
        assertThat(eval("\"a\\tb\\u0041\"")).isEqualTo(Value.of("a\tbA"));
        assertThat(eval("true")).isSameAs(Value.TRUE);
        assertThat(eval("undefined")).isEqualTo(Value.NULL);
        assertThat(eval("[1, 'a']")).isEqualTo(new Value.ListVal(List.of(Value.of(1.0), Value.of("a"))));
    }

    /**
     * Verifies object literals, including quoted and shorthand keys.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testObjectLiterals() throws Exception {
        // Act
        Value value = eval("{a: 1, 'b-c': count, count}");

        // Assert
        Map<String, Value> entries = ((Value.MapVal) value).entries();
        assertThat(entries.keySet()).containsExactly("a", "b-c", "count");
        assertThat(entries.get("count")).isEqualTo(Value.of(5.0));
    }

    /**
     * Verifies member, index and optional access.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testAccess() throws Exception {
        // Assert
        assertThat(text("user.name")).isEqualTo("Ada");
        assertThat(text("user['name']")).isEqualTo("Ada");
        assertThat(text("user.tags[1]")).isEqualTo("dev");
        assertThat(text("items.length")).isEqualTo("3");
        assertThat(eval("items[7]")).isEqualTo(Value.NULL);
        assertThat(eval("user.missing")).isEqualTo(Value.NULL);
        assertThat(eval("none?.name")).isEqualTo(Value.NULL);
        assertThat(eval("unknown")).isEqualTo(Value.NULL);
    }

    /**
     * Verifies that reading through null fails without the optional operator.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testMemberOfNullFails() {
        // Act & Assert
        assertThatThrownBy(() -> eval("none.name"))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("Cannot read property 'name' of null");
    }

    /**
     * Verifies arithmetic, concatenation and precedence.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testArithmeticAndConcatenation() throws Exception {
        // Assert
        assertThat(text("1 + 2 * 3")).isEqualTo("7");
        assertThat(text("(1 + 2) * 3")).isEqualTo("9");
        assertThat(text("7 % 4 - -1")).isEqualTo("4");
        assertThat(text("'n' + 1 + 2")).isEqualTo("n12");
        assertThat(text("1 + 2 + 'n'")).isEqualTo("3n");
        assertThat(text("items + ''")).isEqualTo("1,2,3");
        assertThat(text("1 / 0")).isEqualTo("Infinity");
        assertThat(text("'a' * 2")).isEqualTo("NaN");
    }

    /**
     * Verifies loose and strict equality and ordering.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testComparison() throws Exception {
        // Assert
        assertThat(eval("count == '5'")).isEqualTo(Value.TRUE);
        assertThat(eval("count === '5'")).isEqualTo(Value.FALSE);
        assertThat(eval("none == undefined")).isEqualTo(Value.TRUE);
        assertThat(eval("none == 0")).isEqualTo(Value.FALSE);
        assertThat(eval("items === items")).isEqualTo(Value.TRUE);
        assertThat(eval("[1] === [1]")).isEqualTo(Value.FALSE);
        assertThat(eval("'b' > 'a'")).isEqualTo(Value.TRUE);
        assertThat(eval("'10' < 9")).isEqualTo(Value.FALSE);
        assertThat(eval("none < 1")).isEqualTo(Value.FALSE);
    }

    /**
     * Verifies that logical operators return an operand and short-circuit.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testLogicalOperators() throws Exception {
        // Assert
        assertThat(text("none || 'fallback'")).isEqualTo("fallback");
        assertThat(text("count && 'yes'")).isEqualTo("yes");
        assertThat(eval("0 ?? 1")).isEqualTo(Value.of(0.0));
        assertThat(text("none ?? 'n/a'")).isEqualTo("n/a");
        assertThat(eval("false && none.name")).isEqualTo(Value.FALSE);
        assertThat(text("count > 3 ? 'big' : 'small'")).isEqualTo("big");
        assertThat(eval("!items")).isEqualTo(Value.FALSE);
        assertThat(text("typeof none")).isEqualTo("undefined");
        assertThat(text("typeof user")).isEqualTo("object");
    }

    /**
     * Verifies the available string methods.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testStringMethods() throws Exception {
        // Assert
        assertThat(text("title.trim().toUpperCase()")).isEqualTo("HELLO WORLD");
        assertThat(eval("title.includes('World')")).isEqualTo(Value.TRUE);
        assertThat(text("user.name.slice(-2)")).isEqualTo("da");
        assertThat(text("user.name.substring(2, 0)")).isEqualTo("Ad");
        assertThat(text("'a,b,,c'.split(',').length")).isEqualTo("4");
        assertThat(text("'aXbX'.replace('X', '-')")).isEqualTo("a-bX");
        assertThat(text("'ab'.repeat(3)")).isEqualTo("ababab");
        assertThat(text("user.name.charAt(9)")).isEmpty();
        assertThat(text("user.name.indexOf('z')")).isEqualTo("-1");
    }

    /**
     * Verifies the available list methods.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testListMethods() throws Exception {
        // Assert
        assertThat(text("items.join(' | ')")).isEqualTo("1 | 2 | 3");
        assertThat(text("items.join()")).isEqualTo("1,2,3");
        assertThat(eval("user.tags.includes('dev')")).isEqualTo(Value.TRUE);
        assertThat(text("items.indexOf(3)")).isEqualTo("2");
        assertThat(text("items.slice(1).join('')")).isEqualTo("23");
    }

    /**
     * Verifies that methods outside the fixed set are rejected.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testUnknownMethod() {
        // Act & Assert
        assertThatThrownBy(() -> eval("items.push(4)"))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("Method 'push' is not available on a list value");
    }

    /**
     * Verifies that syntax errors name the offending position and that assignment is rejected.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testSyntaxErrors() {
        // Act & Assert
        assertThatThrownBy(() -> eval("count = 1"))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("Assignment is not supported");
        assertThatThrownBy(() -> eval("(1 + 2"))
                .isInstanceOf(EvaluationException.class);
        assertThatThrownBy(() -> eval("'open"))
                .isInstanceOf(EvaluationException.class);
        assertThatThrownBy(() -> eval("count()"))
                .isInstanceOf(EvaluationException.class);
    }

    /**
     * Verifies that parsed expressions are cached.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testParseCache() throws Exception {
        // Act
        ScriptNode first = evaluator.parse("a + b");
        ScriptNode second = evaluator.parse("a + b");

        // Assert
        assertThat(second).isSameAs(first);
    }

    /**
     * Verifies that the parse cache keeps only the most recently used expressions.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testParseCacheEvictsLeastRecentlyUsed() throws Exception {
        // Arrange
        ScriptEvaluator bounded = new ScriptEvaluator(2);
        ScriptNode a = bounded.parse("a");
        bounded.parse("b");
        bounded.parse("a");

        // Act
        bounded.parse("c");

        // Assert
        assertThat(bounded.cacheSize()).isEqualTo(2);
        assertThat(bounded.parse("a")).isSameAs(a);
        assertThat(bounded.cacheSize()).isEqualTo(2);
    }

    /**
     * Verifies that a disabled parse cache still evaluates and keeps nothing.
     * This is a unit test for the expression evaluator.
     */
    @Test
    @Tag("unit")
    void testDisabledParseCache() throws Exception {
        // Arrange
        ScriptEvaluator uncached = new ScriptEvaluator(0);

        // Act
        ScriptNode first = uncached.parse("1 + 2");
        ScriptNode second = uncached.parse("1 + 2");

        // Assert
        assertThat(second).isNotSameAs(first);
        assertThat(uncached.cacheSize()).isZero();
        assertThatThrownBy(() -> new ScriptEvaluator(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
