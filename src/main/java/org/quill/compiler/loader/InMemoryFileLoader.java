package org.quill.compiler.loader;

import org.quill.compiler.api.IFileLoader;

import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves templates from a map of virtual paths. Used by hosts that keep templates in
 * memory and by tests.
 */
public class InMemoryFileLoader implements IFileLoader {

    private final Map<String, byte[]> files = new ConcurrentHashMap<>();
    private final String templateExtension;

    public InMemoryFileLoader(String templateExtension) {
        this.templateExtension = templateExtension;
    }

    /**
     * Adds or replaces a file.
     * @param path The virtual path, e.g. {@code /layouts/base.pug}.
     * @param content The file content.
     * @return This loader, for chaining.
     */
    public InMemoryFileLoader put(String path, String content) {
        files.put(TemplatePaths.normalize(path), content.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    @Override
    public String resolve(String relativePath, String fromFilePath) {
        return TemplatePaths.resolve(relativePath, fromFilePath, templateExtension);
    }

    @Override
    public byte[] read(String canonicalPath) throws NoSuchFileException {
        byte[] content = files.get(canonicalPath);
        if (content == null) {
            throw new NoSuchFileException(canonicalPath);
        }
        return content.clone();
    }
}
