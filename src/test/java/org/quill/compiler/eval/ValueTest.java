package org.quill.compiler.eval;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.EvaluationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link Value}: conversion from host objects, truthiness and text form.
 */
public class ValueTest {

    /**
     * Verifies the conversion of host objects, including nested collections and arrays.
     * This is a unit test for value conversion.
     */
    @Test
    @Tag("unit")
    void testConversionFromHostObjects() {
        // Arrange
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("n", 3);
        map.put("tags", List.of("a", "b"));

        // Act
        Value value = Value.of((Object) map);

        // Assert
        assertThat(value).isInstanceOf(Value.MapVal.class);
        Map<String, Value> entries = ((Value.MapVal) value).entries();
        assertThat(entries.keySet()).containsExactly("n", "tags");
        assertThat(entries.get("n")).isEqualTo(new Value.Num(3));
        assertThat(entries.get("tags")).isEqualTo(new Value.ListVal(List.of(Value.of("a"), Value.of("b"))));
        assertThat(Value.of((Object) new int[]{1, 2})).isEqualTo(new Value.ListVal(List.of(Value.of(1.0), Value.of(2.0))));
        assertThat(Value.of((Object) null)).isSameAs(Value.NULL);
        assertThat(Value.of((Object) 'c')).isEqualTo(Value.of("c"));
    }

    /**
     * Verifies which values count as true.
     * This is a unit test for value truthiness.
     */
    @Test
    @Tag("unit")
    void testTruthiness() {
        // Assert
        assertThat(Value.NULL.isTruthy()).isFalse();
        assertThat(Value.FALSE.isTruthy()).isFalse();
        assertThat(Value.of(0.0).isTruthy()).isFalse();
        assertThat(Value.of(Double.NaN).isTruthy()).isFalse();
        assertThat(Value.of("").isTruthy()).isFalse();
        assertThat(new Value.ListVal(List.of()).isTruthy()).isFalse();
        assertThat(new Value.MapVal(Map.of()).isTruthy()).isFalse();
        assertThat(Value.of("0").isTruthy()).isTrue();
        assertThat(Value.of(-1.0).isTruthy()).isTrue();
        assertThat(new Value.ListVal(List.of(Value.NULL)).isTruthy()).isTrue();
    }

    /**
     * Verifies the shortest text form of numbers.
     * This is a unit test for number formatting.
     */
    @Test
    @Tag("unit")
    void testNumberFormatting() {
        // Assert
        assertThat(Value.formatNumber(3)).isEqualTo("3");
        assertThat(Value.formatNumber(-0.0)).isEqualTo("0");
        assertThat(Value.formatNumber(2.5)).isEqualTo("2.5");
        assertThat(Value.formatNumber(0.1 + 0.2)).isEqualTo("0.30000000000000004");
        assertThat(Value.formatNumber(1e21)).isEqualTo("1e+21");
        assertThat(Value.formatNumber(1.5e-7)).isEqualTo("1.5e-7");
        assertThat(Value.formatNumber(Double.NaN)).isEqualTo("NaN");
        assertThat(Value.formatNumber(Double.NEGATIVE_INFINITY)).isEqualTo("-Infinity");
    }

    /**
     * Verifies the text form of scalars and that collections have none.
     * This is a unit test for value text conversion.
     */
    @Test
    @Tag("unit")
    void testAsText() throws Exception {
        // Assert
        assertThat(Value.NULL.asText()).isEmpty();
        assertThat(Value.TRUE.asText()).isEqualTo("true");
        assertThat(Value.of(42.0).asText()).isEqualTo("42");
        assertThatThrownBy(() -> new Value.MapVal(Map.of()).asText())
                .isInstanceOf(EvaluationException.class)
                .extracting(e -> ((EvaluationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.UNPRINTABLE_VALUE);
    }
}
