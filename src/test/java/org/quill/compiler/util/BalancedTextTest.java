package org.quill.compiler.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link BalancedText}.
 */
public class BalancedTextTest {

    /**
     * Verifies that quotes and nested brackets do not end a span early.
     * This is a unit test for balanced scanning.
     */
    @Test
    @Tag("unit")
    void testFindClosing() {
        // Assert
        assertThat(BalancedText.findClosing("a, f(')'), [1] ) rest", 0, ')')).isEqualTo(15);
        assertThat(BalancedText.findClosing("x } y", 0, '}')).isEqualTo(2);
        assertThat(BalancedText.findClosing("x ] y", 0, ')')).isEqualTo(-1);
        assertThat(BalancedText.findClosing("'unterminated )", 0, ')')).isEqualTo(-1);
    }

    /**
     * Verifies splitting on top-level separators only.
     * This is a unit test for balanced scanning.
     */
    @Test
    @Tag("unit")
    void testSplitTopLevel() {
        // Assert
        assertThat(BalancedText.splitTopLevel(" a , f(b, c), 'd,e' ", ','))
                .containsExactly("a", "f(b, c)", "'d,e'");
        assertThat(BalancedText.splitTopLevel("   ", ',')).isEmpty();
    }

    /**
     * Verifies that comparison operators are not mistaken for an assignment.
     * This is a unit test for balanced scanning.
     */
    @Test
    @Tag("unit")
    void testIndexOfAssignment() {
        // Assert
        assertThat(BalancedText.indexOfAssignment("size='m'")).isEqualTo(4);
        assertThat(BalancedText.indexOfAssignment("a == b")).isEqualTo(-1);
        assertThat(BalancedText.indexOfAssignment("a <= b")).isEqualTo(-1);
        assertThat(BalancedText.indexOfAssignment("f(x=1)")).isEqualTo(-1);
    }

    /**
     * Verifies literal detection and unquoting.
     * This is a unit test for balanced scanning.
     */
    @Test
    @Tag("unit")
    void testQuotedLiterals() {
        // Assert
        assertThat(BalancedText.isSingleQuotedLiteral("'a\\'b'")).isTrue();
        assertThat(BalancedText.isSingleQuotedLiteral("'a' + 'b'")).isFalse();
        assertThat(BalancedText.isSingleQuotedLiteral("x")).isFalse();
        assertThat(BalancedText.unquote("'a\\'b'")).isEqualTo("a'b");
    }
}
