package org.quill.compiler.loader;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link TemplatePaths}, the path logic shared by the in-memory
 * and classpath loaders.
 */
public class TemplatePathsTest {

    /**
     * Verifies resolution relative to the referencing file, from the root, and for entry templates.
     * This is a unit test for template path resolution.
     */
    @Test
    @Tag("unit")
    void testResolve() {
        // Assert
        assertThat(TemplatePaths.resolve("nav", "/pages/home.pug", ".pug")).isEqualTo("/pages/nav.pug");
        assertThat(TemplatePaths.resolve("../layout", "/pages/home.pug", ".pug")).isEqualTo("/layout.pug");
        assertThat(TemplatePaths.resolve("/shared/nav", "/pages/home.pug", ".pug")).isEqualTo("/shared/nav.pug");
        assertThat(TemplatePaths.resolve("pages/home", null, ".pug")).isEqualTo("/pages/home.pug");
        assertThat(TemplatePaths.resolve("home", "<inline>", ".pug")).isEqualTo("/home.pug");
    }

    /**
     * Verifies that an explicit extension is kept and a missing one added.
     * This is a unit test for template path resolution.
     */
    @Test
    @Tag("unit")
    void testExtension() {
        // Assert
        assertThat(TemplatePaths.withExtension("style.css", ".pug")).isEqualTo("style.css");
        assertThat(TemplatePaths.withExtension("v1.2/page", ".pug")).isEqualTo("v1.2/page.pug");
        assertThat(TemplatePaths.withExtension("page.pug", ".pug")).isEqualTo("page.pug");
    }

    /**
     * Verifies that normalization removes dot segments and never climbs above the root.
     * This is a unit test for template path resolution.
     */
    @Test
    @Tag("unit")
    void testNormalize() {
        // Assert
        assertThat(TemplatePaths.normalize("a/./b//c")).isEqualTo("/a/b/c");
        assertThat(TemplatePaths.normalize("/a/../../b")).isEqualTo("/b");
        assertThat(TemplatePaths.normalize("a\\b")).isEqualTo("/a/b");
    }
}
