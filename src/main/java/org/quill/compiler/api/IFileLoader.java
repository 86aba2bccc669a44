package org.quill.compiler.api;

import java.io.IOException;

/**
 * The file loader collaborator consumed by the template linker to follow
 * {@code extends} and {@code include} references.
 */
public interface IFileLoader {

    /**
     * Resolves a path written in a template against the file that references it.
     *
     * @param relativePath The path as written after {@code extends} or {@code include}.
     * @param fromFilePath The canonical path of the referencing file, or null for the entry template.
     * @return The canonical path of the referenced file.
     */
    String resolve(String relativePath, String fromFilePath);

    /**
     * Reads a template.
     *
     * @param canonicalPath A path previously returned by {@link #resolve(String, String)}.
     * @return The raw bytes of the file.
     * @throws java.nio.file.NoSuchFileException if the file does not exist.
     * @throws IOException if the file cannot be read.
     */
    byte[] read(String canonicalPath) throws IOException;
}
