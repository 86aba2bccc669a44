package org.quill.compiler.frontend.parser.features.block;

import org.quill.compiler.api.CompilerErrorCode;
import org.quill.compiler.api.TemplateSyntaxException;
import org.quill.compiler.frontend.directive.IKeywordHandler;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;
import org.quill.compiler.frontend.parser.ParsedLine;
import org.quill.compiler.frontend.parser.ParsingContext;
import org.quill.compiler.frontend.parser.ast.BlockMode;
import org.quill.compiler.frontend.parser.ast.BlockNode;
import org.quill.compiler.frontend.parser.ast.BlockSlotNode;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Handles {@code block [append|prepend|replace] name} and the short forms
 * {@code append name} and {@code prepend name}. A bare {@code block} inside a mixin
 * definition marks where the caller's block content goes.
 */
public class BlockKeywordHandler implements IKeywordHandler {

    private static final Pattern BLOCK_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    private final BlockMode fixedMode;

    /**
     * @param fixedMode The mode implied by the keyword, or null for {@code block}.
     */
    public BlockKeywordHandler(BlockMode fixedMode) {
        this.fixedMode = fixedMode;
    }

    @Override
    public ParsedLine parse(Token keyword, ParsingContext context) throws TemplateSyntaxException {
        if (fixedMode == null && !context.check(TokenType.ARGUMENT) && context.insideMixinDefinition()) {
            return ParsedLine.leaf(new BlockSlotNode(keyword.source()));
        }
        Token argument = context.consume(TokenType.ARGUMENT, "a block name");
        String[] words = argument.stringValue().split("\\s+");
        BlockMode mode = fixedMode != null ? fixedMode : BlockMode.DEFAULT;
        String name;
        if (fixedMode == null && words.length == 2) {
            mode = parseMode(words[0], argument);
            name = words[1];
        } else if (words.length == 1) {
            name = words[0];
        } else {
            throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_STATEMENT,
                    "Malformed block declaration '" + argument.stringValue() + "'", argument.source(),
                    "'block [append|prepend|replace] name'");
        }
        if (!BLOCK_NAME.matcher(name).matches()) {
            throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_STATEMENT,
                    "Invalid block name '" + name + "'", argument.source(), "a block name");
        }
        context.declareBlock(name, keyword.source());
        BlockNode node = new BlockNode(name, mode, List.of(), keyword.source());
        return ParsedLine.container(node, (current, children) -> ((BlockNode) current).withContent(children));
    }

    private static BlockMode parseMode(String word, Token argument) throws TemplateSyntaxException {
        switch (word.toLowerCase(Locale.ROOT)) {
            case "append":
                return BlockMode.APPEND;
            case "prepend":
                return BlockMode.PREPEND;
            case "replace":
                return BlockMode.REPLACE;
            default:
                throw new TemplateSyntaxException(CompilerErrorCode.UNEXPECTED_STATEMENT,
                        "Unknown block mode '" + word + "'", argument.source(), "append, prepend or replace");
        }
    }
}
