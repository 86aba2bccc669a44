package org.quill.compiler.api;

/**
 * A pure data class representing a position in a template source.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the construct is located.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
