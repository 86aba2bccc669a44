package org.quill.compiler.loader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains integration tests for the {@link FileSystemLoader} against a temporary directory.
 */
public class FileSystemLoaderTest {

    @TempDir
    Path baseDir;

    private FileSystemLoader loader;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(baseDir.resolve("pages"));
        Files.writeString(baseDir.resolve("pages/home.pug"), "p home");
        Files.writeString(baseDir.resolve("layout.pug"), "block content");
        loader = new FileSystemLoader(baseDir, ".pug");
    }

    /**
     * Verifies that entry paths resolve against the base directory and references against
     * the directory of the referencing file.
     * This is an integration test for the file system loader.
     */
    @Test
    @Tag("integration")
    void testResolve() {
        // Act
        String entry = loader.resolve("pages/home", null);
        String relative = loader.resolve("../layout", entry);
        String rooted = loader.resolve("/layout", entry);

        // Assert
        Path base = baseDir.toAbsolutePath().normalize();
        assertThat(entry).isEqualTo(base.resolve("pages/home.pug").toString());
        assertThat(relative).isEqualTo(base.resolve("layout.pug").toString());
        assertThat(rooted).isEqualTo(relative);
    }

    /**
     * Verifies reading an existing file and the error for a missing one.
     * This is an integration test for the file system loader.
     */
    @Test
    @Tag("integration")
    void testRead() throws Exception {
        // Act
        byte[] content = loader.read(loader.resolve("pages/home", null));

        // Assert
        assertThat(new String(content, StandardCharsets.UTF_8)).isEqualTo("p home");
        assertThatThrownBy(() -> loader.read(loader.resolve("nope", null))).isInstanceOf(NoSuchFileException.class);
    }
}
