package org.quill.compiler.frontend;

import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.parser.ast.Template;

/**
 * Turns the source of one file into a {@link Template}. The linker parses every
 * referenced file through this seam, so hosts can decorate it (e.g. with a cache).
 */
@FunctionalInterface
public interface ITemplateParser {

    /**
     * @param source The template source.
     * @param fileName The canonical name of the file.
     * @return The parsed template.
     * @throws TemplateSyntaxException if the source is malformed.
     */
    Template parse(String source, String fileName) throws TemplateSyntaxException;
}
