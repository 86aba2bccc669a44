package org.quill.compiler.frontend;

import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.lexer.Lexer;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.parser.Parser;
import org.quill.compiler.frontend.parser.ast.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The default {@link ITemplateParser}: a fresh {@link Lexer} and {@link Parser} per file.
 */
public class TemplateParser implements ITemplateParser {

    private static final Logger log = LoggerFactory.getLogger(TemplateParser.class);

    @Override
    public Template parse(String source, String fileName) throws TemplateSyntaxException {
        List<Token> tokens = new Lexer(source, fileName).scanTokens();
        Template template = new Parser(tokens, fileName).parse();
        log.debug("Parsed {}: {} tokens, {} top-level nodes", fileName, tokens.size(), template.nodes().size());
        return template;
    }
}
