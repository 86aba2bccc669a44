package org.quill.compiler.loader;

import org.quill.compiler.api.IFileLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads templates from the file system. References starting with {@code /} resolve
 * against the base directory, all others against the directory of the referencing file.
 * Canonical paths are absolute, normalized file paths.
 */
public class FileSystemLoader implements IFileLoader {

    private final Path baseDirectory;
    private final String templateExtension;

    /**
     * @param baseDirectory The directory that {@code /}-prefixed references and entry templates resolve against.
     * @param templateExtension The extension appended to references without one.
     */
    public FileSystemLoader(Path baseDirectory, String templateExtension) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
        this.templateExtension = templateExtension;
    }

    @Override
    public String resolve(String relativePath, String fromFilePath) {
        String path = TemplatePaths.withExtension(relativePath, templateExtension);
        Path resolved;
        if (path.startsWith("/")) {
            resolved = baseDirectory.resolve(path.substring(1));
        } else if (TemplatePaths.isEntry(fromFilePath)) {
            resolved = baseDirectory.resolve(path);
        } else {
            Path parent = Path.of(fromFilePath).getParent();
            resolved = (parent != null ? parent : baseDirectory).resolve(path);
        }
        return resolved.toAbsolutePath().normalize().toString();
    }

    @Override
    public byte[] read(String canonicalPath) throws IOException {
        return Files.readAllBytes(Path.of(canonicalPath));
    }
}
