package org.quill.compiler.frontend.parser;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ast.AttributeNode;
import org.quill.compiler.frontend.parser.ast.AttributeValue;
import org.quill.compiler.frontend.parser.ast.TextSegment;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link AttributeListParser}.
 */
public class AttributeListParserTest {

    private static List<AttributeNode> parse(String text) throws TemplateSyntaxException {
        return AttributeListParser.parse(new Token(TokenType.ATTRIBUTES, "(" + text + ")", text, 1, 2, "test.pug"));
    }

    /**
     * Verifies that entries may be separated by commas or whitespace and that a bare name is a flag.
     * This is a unit test for the attribute list parser.
     */
    @Test
    @Tag("unit")
    void testSeparatorsAndFlags() throws Exception {
        // Act
        List<AttributeNode> attributes = parse("type='checkbox' checked, name=\"agree\"");

        // Assert
        assertThat(attributes).extracting(AttributeNode::name).containsExactly("type", "checked", "name");
        assertThat(attributes.get(0).value()).isEqualTo(new AttributeValue.Expression("'checkbox'"));
        assertThat(attributes.get(1).value()).isInstanceOf(AttributeValue.Flag.class);
        assertThat(attributes.get(2).value()).isEqualTo(new AttributeValue.Expression("\"agree\""));
    }

    /**
     * Verifies that whitespace around an operator continues the value, while plain
     * whitespace starts the next entry.
     * This is a unit test for the attribute list parser.
     */
    @Test
    @Tag("unit")
    void testOperatorsContinueValues() throws Exception {
        // Act
        List<AttributeNode> attributes = parse("a=x + 1 b=2 c=f(1, 2)");

        // Assert
        assertThat(attributes).extracting(a -> ((AttributeValue.Expression) a.value()).expression())
                .containsExactly("x + 1", "2", "f(1, 2)");
    }

    /**
     * Verifies that {@code !=} marks an attribute as unescaped.
     * This is a unit test for the attribute list parser.
     */
    @Test
    @Tag("unit")
    void testUnescapedValue() throws Exception {
        // Act
        List<AttributeNode> attributes = parse("title!='<b>' alt='x'");

        // Assert
        assertThat(attributes.get(0).escaped()).isFalse();
        assertThat(attributes.get(1).escaped()).isTrue();
    }

    /**
     * Verifies that a quoted literal containing an interpolation becomes segments.
     * This is a unit test for the attribute list parser.
     */
    @Test
    @Tag("unit")
    void testInterpolatedValue() throws Exception {
        // Act
        AttributeValue value = parse("href='/users/#{user.id}'").get(0).value();

        // Assert
        assertThat(value).isInstanceOf(AttributeValue.Interpolated.class);
        List<TextSegment> segments = ((AttributeValue.Interpolated) value).segments();
        assertThat(segments).hasSize(2);
        assertThat(segments.get(0)).isEqualTo(new TextSegment.Literal("/users/"));
        assertThat(((TextSegment.ExpressionSpan) segments.get(1)).expression()).isEqualTo("user.id");
    }

    /**
     * Verifies that quoted attribute names are accepted.
     * This is a unit test for the attribute list parser.
     */
    @Test
    @Tag("unit")
    void testQuotedName() throws Exception {
        // Act
        List<AttributeNode> attributes = parse("'(click)'='go()'");

        // Assert
        assertThat(attributes.get(0).name()).isEqualTo("(click)");
    }

    /**
     * Verifies that an assignment without a value is rejected.
     * This is a unit test for the attribute list parser.
     */
    @Test
    @Tag("unit")
    void testMissingValue() {
        // Act & Assert
        assertThatThrownBy(() -> parse("href= , x=1"))
                .isInstanceOf(TemplateSyntaxException.class)
                .extracting(e -> ((TemplateSyntaxException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.INVALID_ATTRIBUTE);
    }
}
