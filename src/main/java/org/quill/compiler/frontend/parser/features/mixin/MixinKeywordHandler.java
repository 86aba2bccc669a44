package org.quill.compiler.frontend.parser.features.mixin;

import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;
import org.quill.compiler.frontend.parser.ast.MixinDefNode;

import java.util.List;

/**
 * Handles {@code mixin name(params)}. The deeper lines become the mixin body.
 */
public class MixinKeywordHandler implements IKeywordHandler {

    @Override
    public ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException {
        Token signatureToken = context.consume(TokenType.ARGUMENT, "a mixin name");
        MixinSignatures.Signature signature = MixinSignatures.parseDefinition(signatureToken.stringValue(), signatureToken.source());
        MixinDefNode node = new MixinDefNode(signature.name(), signature.params(), signature.restParam(),
                List.of(), keyword.source());
        return ParsedLine.container(node, (current, children) -> current.withBodies(List.of(children)));
    }
}
