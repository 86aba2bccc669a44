package org.quill.compiler.backend.expand;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.ExpansionException;
import org.quill.compiler.diagnostics.DiagnosticsEngine;
import org.quill.compiler.frontend.TemplateParser;
import org.quill.compiler.frontend.parser.ast.AstNode;
import org.quill.compiler.frontend.parser.ast.CallerBlockNode;
import org.quill.compiler.frontend.parser.ast.ElementNode;
import org.quill.compiler.frontend.parser.ast.MixinScopeNode;
import org.quill.compiler.frontend.parser.ast.ParameterBinding;
import org.quill.junit.extensions.logging.ExpectLog;
import org.quill.junit.extensions.logging.LogLevel;
import org.quill.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link MixinExpander}.
 */
@ExtendWith(LogWatchExtension.class)
public class MixinExpanderTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private List<AstNode> expand(int limit, String... lines) throws Exception {
        List<AstNode> nodes = new TemplateParser().parse(String.join("\n", lines), "test.pug").nodes();
        return new MixinExpander(limit, diagnostics).expand(nodes);
    }

    /**
     * Verifies that a call may precede the definition and that definitions are removed.
     * This is a unit test for the mixin expander.
     */
    @Test
    @Tag("unit")
    void testCallBeforeDefinition() throws Exception {
        // Act
        List<AstNode> nodes = expand(10,
                "+greet",
                "mixin greet",
                "  p hello");

        // Assert
        assertThat(nodes).hasSize(1);
        MixinScopeNode scope = (MixinScopeNode) nodes.get(0);
        assertThat(scope.mixinName()).isEqualTo("greet");
        assertThat(((ElementNode) scope.body().get(0)).name()).isEqualTo("p");
    }

    /**
     * Verifies the binding of arguments, defaults, missing parameters and the rest parameter.
     * This is a unit test for the mixin expander.
     */
    @Test
    @Tag("unit")
    void testBindings() throws Exception {
        // Act
        List<AstNode> nodes = expand(10,
                "mixin item(a, b='x', c, ...more)",
                "  p= a",
                "+item(1)",
                "+item(1, 2, 3, 4, 5)");

        // Assert
        MixinScopeNode first = (MixinScopeNode) nodes.get(0);
        assertThat(first.bindings()).containsExactly(
                ParameterBinding.argument("a", "1"),
                ParameterBinding.defaulted("b", "'x'"),
                ParameterBinding.undefined("c"),
                ParameterBinding.rest("more", List.of()));
        MixinScopeNode second = (MixinScopeNode) nodes.get(1);
        assertThat(second.bindings().get(3)).isEqualTo(ParameterBinding.rest("more", List.of("4", "5")));
    }

    /**
     * Verifies that the caller's block content replaces the block marker.
     * This is a unit test for the mixin expander.
     */
    @Test
    @Tag("unit")
    void testBlockContentFillsSlot() throws Exception {
        // Act
        List<AstNode> nodes = expand(10,
                "mixin box",
                "  div.box",
                "    block",
                "+box",
                "  p inside");

        // Assert
        MixinScopeNode scope = (MixinScopeNode) nodes.get(0);
        ElementNode box = (ElementNode) scope.body().get(0);
        CallerBlockNode block = (CallerBlockNode) box.children().get(0);
        assertThat(box.children()).hasSize(1);
        assertThat(block.content()).singleElement()
                .satisfies(child -> assertThat(((ElementNode) child).name()).isEqualTo("p"));
    }

    /**
     * Verifies that mixin calls nested in other mixins and in block content are expanded too.
     * This is a unit test for the mixin expander.
     */
    @Test
    @Tag("unit")
    void testNestedCalls() throws Exception {
        // Act
        List<AstNode> nodes = expand(10,
                "mixin inner",
                "  span inner",
                "mixin outer",
                "  div",
                "    +inner",
                "    block",
                "+outer",
                "  +inner");

        // Assert
        MixinScopeNode outer = (MixinScopeNode) nodes.get(0);
        ElementNode div = (ElementNode) outer.body().get(0);
        assertThat(div.children()).hasSize(2);
        assertThat(div.children().get(0)).isInstanceOf(MixinScopeNode.class);
        assertThat(((CallerBlockNode) div.children().get(1)).content())
                .singleElement().isInstanceOf(MixinScopeNode.class);
    }

    /**
     * Verifies that a call to an undefined mixin is rejected.
     * This is a unit test for the mixin expander.
     */
    @Test
    @Tag("unit")
    void testUnknownMixin() {
        // Act & Assert
        assertThatThrownBy(() -> expand(10, "+missing"))
                .isInstanceOf(ExpansionException.class)
                .extracting(e -> ((ExpansionException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.UNKNOWN_MIXIN);
    }

    /**
     * Verifies that a recursive mixin stops at the nesting limit.
     * This is a unit test for the mixin expander.
     */
    @Test
    @Tag("unit")
    void testRecursionLimit() {
        // Act & Assert
        assertThatThrownBy(() -> expand(5,
                "mixin tree(n)",
                "  if n > 0",
                "    +tree(n - 1)",
                "+tree(3)"))
                .isInstanceOf(ExpansionException.class)
                .hasMessageContaining("deeper than 5 levels")
                .extracting(e -> ((ExpansionException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.MIXIN_RECURSION_LIMIT);
    }

    /**
     * Verifies that redefining a mixin replaces the earlier definition with a warning.
     * This is a unit test for the mixin expander.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Mixin 'm' is defined again.*")
    void testRedefinitionWarns() throws Exception {
        // Act
        List<AstNode> nodes = expand(10,
                "mixin m",
                "  p first",
                "mixin m",
                "  span second",
                "+m");

        // Assert
        MixinScopeNode scope = (MixinScopeNode) nodes.get(0);
        assertThat(((ElementNode) scope.body().get(0)).name()).isEqualTo("span");
        assertThat(diagnostics.hasWarnings()).isTrue();
    }

    /**
     * Verifies that surplus arguments without a rest parameter are dropped with a warning.
     * This is a unit test for the mixin expander.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*takes 1 argument\\(s\\) but was called with 2.*")
    void testSurplusArgumentsWarn() throws Exception {
        // Act
        List<AstNode> nodes = expand(10,
                "mixin one(a)",
                "  p= a",
                "+one(1, 2)");

        // Assert
        assertThat(((MixinScopeNode) nodes.get(0)).bindings()).containsExactly(ParameterBinding.argument("a", "1"));
    }
}
