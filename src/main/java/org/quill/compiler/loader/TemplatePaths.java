package org.quill.compiler.loader;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Path arithmetic for loaders whose canonical paths are virtual, {@code /}-separated
 * and rooted at {@code /}.
 */
final class TemplatePaths {

    private TemplatePaths() {}

    /**
     * Resolves a referenced path. A leading {@code /} resolves against the root, anything
     * else against the directory of the referencing file.
     */
    static String resolve(String relativePath, String fromFilePath, String templateExtension) {
        String path = withExtension(relativePath, templateExtension);
        if (path.startsWith("/") || isEntry(fromFilePath)) {
            return normalize(path);
        }
        int slash = fromFilePath.lastIndexOf('/');
        String directory = slash >= 0 ? fromFilePath.substring(0, slash) : "";
        return normalize(directory + "/" + path);
    }

    /**
     * Appends the template extension when the last path segment has none.
     */
    static String withExtension(String path, String templateExtension) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        return name.contains(".") ? path : path + templateExtension;
    }

    /**
     * @return Whether the path names no real file, i.e. an entry template compiled from memory.
     */
    static boolean isEntry(String fromFilePath) {
        return fromFilePath == null || fromFilePath.startsWith("<");
    }

    /**
     * Collapses {@code .}, {@code ..} and repeated separators. {@code ..} never climbs above the root.
     */
    static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                segments.pollLast();
            } else {
                segments.addLast(segment);
            }
        }
        return "/" + String.join("/", segments);
    }
}
