package org.quill.compiler.frontend.directive;

import org.quill.compiler.frontend.parser.features.block.BlockKeywordHandler;
import org.quill.compiler.frontend.parser.features.casewhen.CaseKeywordHandler;
import org.quill.compiler.frontend.parser.features.casewhen.DefaultKeywordHandler;
import org.quill.compiler.frontend.parser.features.casewhen.WhenKeywordHandler;
import org.quill.compiler.frontend.parser.features.conditional.ElseIfKeywordHandler;
import org.quill.compiler.frontend.parser.features.conditional.ElseKeywordHandler;
import org.quill.compiler.frontend.parser.features.conditional.IfKeywordHandler;
import org.quill.compiler.frontend.parser.features.each.EachKeywordHandler;
import org.quill.compiler.frontend.parser.features.include.IncludeKeywordHandler;
import org.quill.compiler.frontend.parser.features.inheritance.ExtendsKeywordHandler;
import org.quill.compiler.frontend.parser.features.mixin.MixinKeywordHandler;
import org.quill.compiler.frontend.parser.ast.BlockMode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for keyword handlers. This class holds a map of keywords
 * to their corresponding handlers.
 */
public class KeywordHandlerRegistry {
    private final Map<String, IKeywordHandler> handlers = new HashMap<>();

    /**
     * Registers a new keyword handler.
     * @param keyword The keyword (e.g., "if", "else if").
     * @param handler The handler for the keyword.
     */
    public void register(String keyword, IKeywordHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IKeywordHandler> get(String keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes the keyword handler registry with all the built-in handlers.
     * @return A new instance of {@link KeywordHandlerRegistry} with all handlers registered.
     */
    public static KeywordHandlerRegistry initialize() {
        KeywordHandlerRegistry registry = new KeywordHandlerRegistry();
        registry.register("if", new IfKeywordHandler(false));
        registry.register("unless", new IfKeywordHandler(true));
        registry.register("else if", new ElseIfKeywordHandler());
        registry.register("else", new ElseKeywordHandler());

        EachKeywordHandler eachHandler = new EachKeywordHandler();
        registry.register("each", eachHandler);
        registry.register("for", eachHandler);

        registry.register("case", new CaseKeywordHandler());
        registry.register("when", new WhenKeywordHandler());
        registry.register("default", new DefaultKeywordHandler());

        registry.register("mixin", new MixinKeywordHandler());

        registry.register("block", new BlockKeywordHandler(null));
        registry.register("append", new BlockKeywordHandler(BlockMode.APPEND));
        registry.register("prepend", new BlockKeywordHandler(BlockMode.PREPEND));

        registry.register("extends", new ExtendsKeywordHandler());
        registry.register("include", new IncludeKeywordHandler());
        return registry;
    }
}
