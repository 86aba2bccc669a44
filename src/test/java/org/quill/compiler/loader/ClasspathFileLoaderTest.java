package org.quill.compiler.loader;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ClasspathFileLoader}, reading the templates under
 * {@code src/test/resources/templates}.
 */
public class ClasspathFileLoaderTest {

    /**
     * Verifies that resources are read below the configured root.
     * This is a unit test for the classpath loader.
     */
    @Test
    @Tag("unit")
    void testReadBelowRoot() throws Exception {
        // Arrange
        ClasspathFileLoader loader = new ClasspathFileLoader("/templates/", ".pug");

        // Act
        String path = loader.resolve("partials/footer", "/layout.pug");
        String content = new String(loader.read(path), StandardCharsets.UTF_8);

        // Assert
        assertThat(path).isEqualTo("/partials/footer.pug");
        assertThat(content).startsWith("footer");
    }

    /**
     * Verifies that a missing resource is reported as a missing file.
     * This is a unit test for the classpath loader.
     */
    @Test
    @Tag("unit")
    void testMissingResource() {
        // Arrange
        ClasspathFileLoader loader = new ClasspathFileLoader("templates", ".pug", getClass().getClassLoader());

        // Act & Assert
        assertThatThrownBy(() -> loader.read("/missing.pug"))
                .isInstanceOf(NoSuchFileException.class)
                .hasMessageContaining("templates/missing.pug");
    }
}
