package org.quill.compiler;

import com.typesafe.config.ConfigFactory;
import org.quill.compiler.api.RenderMode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains tests for {@link CompileOptions} and the layered configuration it is read from.
 */
public class CompileOptionsTest {

    /**
     * Verifies the values shipped in {@code reference.conf}.
     * This is a unit test for the compiler options.
     */
    @Test
    @Tag("unit")
    void testDefaults() {
        // Act
        CompileOptions options = CompileOptions.defaults();

        // Assert
        assertThat(options.mode()).isEqualTo(RenderMode.COMPACT);
        assertThat(options.indent()).isEqualTo("  ");
        assertThat(options.mixinRecursionLimit()).isEqualTo(100);
        assertThat(options.templateExtension()).isEqualTo(".pug");
        assertThat(options.cacheMaxEntries()).isEqualTo(256);
        assertThat(options.expressionCacheMaxEntries()).isEqualTo(1024);
    }

    /**
     * Verifies that a configuration file overrides some keys and falls back for the rest.
     * This is an integration test for the compiler options.
     */
    @Test
    @Tag("integration")
    void testFileOverrides(@TempDir Path tempDir) throws Exception {
        // Arrange
        Path file = tempDir.resolve("quill.conf");
        Files.writeString(file, "quill.compiler { pretty = true, indent = \"\\t\" }\nquill.cache.max-entries = 0\nquill.script.parse-cache-max-entries = 16\n");

        // Act
        CompileOptions options = CompileOptions.load(file.toFile());

        // Assert
        assertThat(options.mode()).isEqualTo(RenderMode.PRETTY);
        assertThat(options.indent()).isEqualTo("\t");
        assertThat(options.cacheMaxEntries()).isZero();
        assertThat(options.expressionCacheMaxEntries()).isEqualTo(16);
        assertThat(options.mixinRecursionLimit()).isEqualTo(100);
    }

    /**
     * Verifies that a missing configuration file leaves the defaults in place.
     * This is an integration test for the compiler options.
     */
    @Test
    @Tag("integration")
    void testMissingFile(@TempDir Path tempDir) {
        // Act
        CompileOptions options = CompileOptions.load(new File(tempDir.toFile(), "absent.conf"));

        // Assert
        assertThat(options.templateExtension()).isEqualTo(".pug");
    }

    /**
     * Verifies validation and the copy methods.
     * This is a unit test for the compiler options.
     */
    @Test
    @Tag("unit")
    void testValidationAndCopies() {
        // Arrange
        CompileOptions options = CompileOptions.fromConfig(ConfigFactory.parseString(
                "quill.compiler { pretty = false, indent = \"  \", mixin-recursion-limit = 3, template-extension = \".jade\" }\n"
                        + "quill.cache.max-entries = 1\nquill.script.parse-cache-max-entries = 0"));

        // Act
        CompileOptions pretty = options.withMode(RenderMode.PRETTY).withMixinRecursionLimit(7);

        // Assert
        assertThat(pretty.mode()).isEqualTo(RenderMode.PRETTY);
        assertThat(pretty.mixinRecursionLimit()).isEqualTo(7);
        assertThat(pretty.templateExtension()).isEqualTo(".jade");
        assertThatThrownBy(() -> options.withMixinRecursionLimit(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CompileOptions(RenderMode.COMPACT, "", 1, ".pug", -1, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CompileOptions(RenderMode.COMPACT, "", 1, ".pug", 0, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
