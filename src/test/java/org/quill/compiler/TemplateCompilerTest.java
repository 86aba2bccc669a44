package org.quill.compiler;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.IndentationException;
import org.quill.compiler.api.LinkException;
import org.quill.compiler.api.RenderArtifact;
import org.quill.compiler.api.RenderMode;
import org.quill.compiler.diagnostics.Diagnostic;
import org.quill.compiler.eval.VariableEnvironment;
import org.quill.compiler.loader.ClasspathFileLoader;
import org.quill.compiler.loader.InMemoryFileLoader;
import org.quill.junit.extensions.logging.ExpectLog;
import org.quill.junit.extensions.logging.LogLevel;
import org.quill.junit.extensions.logging.LogWatchExtension;
import org.quill.script.ScriptEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for the {@link TemplateCompiler}: source or file in, HTML out.
 */
@ExtendWith(LogWatchExtension.class)
public class TemplateCompilerTest {

    private InMemoryFileLoader files;
    private TemplateCompiler compiler;

    @BeforeEach
    void setUp() {
        files = new InMemoryFileLoader(".pug");
        compiler = new TemplateCompiler(files);
    }

    private String render(String source, VariableEnvironment environment) throws Exception {
        return compiler.render(source, environment);
    }

    private String render(String source) throws Exception {
        return render(source, new VariableEnvironment());
    }

    /**
     * Verifies the nesting of classes, ids and text.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testClassesIdsAndNesting() throws Exception {
        // Act & Assert
        assertThat(render("div.container\n  p#importante Hello"))
                .isEqualTo("<div class=\"container\"><p id=\"importante\">Hello</p></div>");
    }

    /**
     * Verifies interpolation of a conditional expression.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testInterpolatedTernary() throws Exception {
        // Act & Assert
        assertThat(render("p Adult: #{age >= 18 ? 'Yes' : 'No'}", new VariableEnvironment().set("age", 20)))
                .isEqualTo("<p>Adult: Yes</p>");
    }

    /**
     * Verifies that the same source and environment always give the same output.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testIdempotence() throws Exception {
        // Arrange
        String source = "ul\n  each n, i in nums\n    li(class={odd: i % 2 == 1})= n * 2";
        VariableEnvironment environment = new VariableEnvironment().set("nums", List.of(1, 2, 3));

        // Act
        String first = render(source, environment);
        String second = render(source, environment);

        // Assert
        assertThat(first).isEqualTo("<ul><li>2</li><li class=\"odd\">4</li><li>6</li></ul>");
        assertThat(second).isEqualTo(first);
    }

    /**
     * Verifies the fold over three levels of inheritance, compiled from files.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testInheritanceFold() throws Exception {
        // Arrange
        files.put("/grandparent.pug", "html\n  body\n    block x\n      | A");
        files.put("/parent.pug", "extends grandparent\nblock append x\n  | B");
        files.put("/child.pug", "extends parent\nblock replace x\n  | C");

        // Act
        RenderArtifact parent = compiler.compileFile("parent", new VariableEnvironment());
        RenderArtifact child = compiler.compileFile("child", new VariableEnvironment());

        // Assert
        assertThat(parent.html()).isEqualTo("<html><body>AB</body></html>");
        assertThat(child.html()).isEqualTo("<html><body>C</body></html>");
        assertThat(child.sourceFiles()).containsExactly("/child.pug", "/parent.pug", "/grandparent.pug");
    }

    /**
     * Verifies that an empty list renders only the else body and a full list the body with indices.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testEachElse() throws Exception {
        // Arrange
        String source = "each item, index in items\n  p #{index}=#{item}\nelse\n  p none";

        // Act & Assert
        assertThat(render(source, new VariableEnvironment().set("items", List.of())))
                .isEqualTo("<p>none</p>");
        assertThat(render(source, new VariableEnvironment().set("items", List.of("a", "b", "c"))))
                .isEqualTo("<p>0=a</p><p>1=b</p><p>2=c</p>");
    }

    /**
     * Verifies that a parameter without an argument takes its default.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testMixinDefault() throws Exception {
        // Act & Assert
        assertThat(render("mixin icon(name, size='medium')\n  i(class=size)= name\n+icon('home')"))
                .isEqualTo("<i class=\"medium\">home</i>");
    }

    /**
     * Verifies that a mixin body sees the environment and its own parameters only, and that
     * its bindings stay inside the expansion.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testMixinScoping() throws Exception {
        // Act & Assert
        assertThat(render("mixin show\n  p= x\neach x in [1, 2]\n  +show")).isEqualTo("<p></p><p></p>");
        assertThat(render("mixin m(y)\n  p= y\n+m(1)\np= y")).isEqualTo("<p>1</p><p></p>");
        assertThat(render("mixin outer(x)\n  +inner()\nmixin inner()\n  p= x\n+outer(1)\np= x"))
                .isEqualTo("<p></p><p></p>");
    }

    /**
     * Verifies that the block content of a call is rendered in the scope of the call.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testMixinBlockUsesCallerScope() throws Exception {
        // Arrange
        VariableEnvironment environment = new VariableEnvironment().set("title", "Outer");

        // Act & Assert
        assertThat(render("mixin card(title)\n  h1= title\n  block\n+card('Inner')\n  p= title", environment))
                .isEqualTo("<h1>Inner</h1><p>Outer</p>");
        assertThat(render("mixin box\n  div\n    block\neach x in [1, 2]\n  +box\n    p= x"))
                .isEqualTo("<div><p>1</p></div><div><p>2</p></div>");
        assertThat(render(String.join("\n",
                "mixin inner(title)",
                "  section",
                "    h2= title",
                "    block",
                "mixin outer(title)",
                "  +inner('in')",
                "    block",
                "+outer('out')",
                "  p= title"), environment))
                .isEqualTo("<section><h2>in</h2><p>Outer</p></section>");
    }

    /**
     * Verifies escaped and raw interpolation.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testEscaping() throws Exception {
        // Act & Assert
        assertThat(render("p #{\"<b>\"}")).isEqualTo("<p>&lt;b&gt;</p>");
        assertThat(render("p !{\"<b>\"}")).isEqualTo("<p><b></p>");
    }

    /**
     * Verifies that indentation not matching the unit fails the compile.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testMalformedIndentation() {
        // Act & Assert
        assertThatThrownBy(() -> render("div\n  p a\n   p b"))
                .isInstanceOf(IndentationException.class)
                .extracting(e -> ((IndentationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.INCONSISTENT_INDENTATION);
    }

    /**
     * Verifies that an expression that would fail is not evaluated in an untaken branch.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testShortCircuit() throws Exception {
        // Act & Assert
        assertThat(render("if false\n  p= missing.field\nelse\n  p ok")).isEqualTo("<p>ok</p>");
    }

    /**
     * Verifies that a missing entry template is reported as such.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testMissingEntry() {
        // Act & Assert
        assertThatThrownBy(() -> compiler.compileFile("absent", new VariableEnvironment()))
                .isInstanceOf(LinkException.class)
                .hasMessageContaining("/absent.pug")
                .extracting(e -> ((LinkException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.TEMPLATE_NOT_FOUND);
    }

    /**
     * Verifies that warnings of a compile are returned with its output.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Filter 'markdown' is not executed.*")
    void testDiagnosticsInArtifact() throws Exception {
        // Arrange
        files.put("/notes.md", "*hi*");

        // Act
        RenderArtifact artifact = compiler.compileSource("div\n  include:markdown notes.md", "<inline>",
                new VariableEnvironment());

        // Assert
        assertThat(artifact.html()).isEqualTo("<div>*hi*</div>");
        assertThat(artifact.diagnostics()).singleElement()
                .satisfies(d -> assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING));
    }

    /**
     * Verifies that a compile served from the template cache reports the same warnings
     * as the first compile of that source.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Mixin 'm' is defined again.*", occurrences = 2)
    void testDiagnosticsRepeatOnCachedCompile() throws Exception {
        // Arrange
        String source = "mixin m\n  p a\nmixin m\n  p b\n+m";

        // Act
        RenderArtifact first = compiler.compileSource(source, "/twice.pug", new VariableEnvironment());
        RenderArtifact second = compiler.compileSource(source, "/twice.pug", new VariableEnvironment());

        // Assert
        assertThat(second.html()).isEqualTo(first.html()).isEqualTo("<p>b</p>");
        assertThat(second.diagnostics()).isEqualTo(first.diagnostics()).hasSize(1);
    }

    /**
     * Verifies pretty output through the options.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testPrettyMode() throws Exception {
        // Arrange
        TemplateCompiler pretty = new TemplateCompiler(files, new ScriptEvaluator(),
                CompileOptions.defaults().withMode(RenderMode.PRETTY));

        // Act
        String html = pretty.render("doctype html\nhtml\n  body\n    p Hi", new VariableEnvironment());

        // Assert
        assertThat(html).isEqualTo("<!DOCTYPE html>\n<html>\n  <body>\n    <p>Hi</p>\n  </body>\n</html>");
    }

    /**
     * Verifies a page and layout read from class-path resources.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testClasspathTemplates() throws Exception {
        // Arrange
        TemplateCompiler classpath = new TemplateCompiler(new ClasspathFileLoader("templates", ".pug"));
        VariableEnvironment environment = VariableEnvironment.of(Map.of(
                "title", "Home",
                "user", Map.of("name", "Ada"),
                "items", List.of("a", "b")));

        // Act
        RenderArtifact artifact = classpath.compileFile("page", environment);

        // Assert
        assertThat(artifact.html()).isEqualTo("<!DOCTYPE html><html><head><title>Home</title></head><body>"
                + "<h1>Welcome, Ada!</h1><ul><li>a</li><li>b</li></ul>"
                + "<footer><p>&copy; Quill</p></footer></body></html>");
        assertThat(artifact.sourceFiles()).containsExactly("/page.pug", "/layout.pug", "/partials/footer.pug");
    }

    /**
     * Verifies that one compiler instance can serve concurrent compiles.
     * This is an integration test for the compiler.
     */
    @Test
    @Tag("integration")
    void testConcurrentCompiles() throws Exception {
        // Arrange
        files.put("/layout.pug", "main\n  block body");
        files.put("/page.pug", "extends layout\nblock body\n  each n in nums\n    span= n");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Callable<String>> tasks = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            int n = i;
            tasks.add(() -> compiler.compileFile("page", new VariableEnvironment().set("nums", List.of(n))).html());
        }

        // Act
        List<Future<String>> results;
        try {
            results = executor.invokeAll(tasks);
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }

        // Assert
        for (int i = 0; i < results.size(); i++) {
            assertThat(results.get(i).get()).isEqualTo("<main><span>" + i + "</span></main>");
        }
    }
}
