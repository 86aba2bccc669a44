package org.quill.compiler.loader;

import org.quill.compiler.api.IFileLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;

/**
 * Loads templates from class-path resources below a root directory. Canonical paths are
 * virtual paths relative to that root.
 */
public class ClasspathFileLoader implements IFileLoader {

    private final String root;
    private final String templateExtension;
    private final ClassLoader classLoader;

    /**
     * @param root The resource directory holding the templates, e.g. {@code templates}.
     * @param templateExtension The extension appended to references without one.
     * @param classLoader The class loader to load resources with.
     */
    public ClasspathFileLoader(String root, String templateExtension, ClassLoader classLoader) {
        String trimmed = TemplatePaths.normalize(root).substring(1);
        this.root = trimmed.isEmpty() ? "" : trimmed + "/";
        this.templateExtension = templateExtension;
        this.classLoader = classLoader;
    }

    public ClasspathFileLoader(String root, String templateExtension) {
        this(root, templateExtension, Thread.currentThread().getContextClassLoader());
    }

    @Override
    public String resolve(String relativePath, String fromFilePath) {
        return TemplatePaths.resolve(relativePath, fromFilePath, templateExtension);
    }

    @Override
    public byte[] read(String canonicalPath) throws IOException {
        String resource = root + canonicalPath.substring(1);
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new NoSuchFileException(resource);
            }
            return in.readAllBytes();
        }
    }
}
