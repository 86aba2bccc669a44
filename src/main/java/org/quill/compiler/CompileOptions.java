package org.quill.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.quill.compiler.api.RenderMode;
import org.quill.compiler.config.ConfigLoader;

import java.io.File;

/**
 * Immutable compiler settings, read from the {@code quill} configuration tree.
 *
 * @param mode The output formatting.
 * @param indent The indentation of one level in pretty output.
 * @param mixinRecursionLimit The maximum nesting of mixin expansions.
 * @param templateExtension The extension of template files.
 * @param cacheMaxEntries The capacity of the parsed-template cache; 0 disables it.
 * @param expressionCacheMaxEntries The capacity of the built-in evaluator's expression cache; 0 disables it.
 */
public record CompileOptions(
        RenderMode mode,
        String indent,
        int mixinRecursionLimit,
        String templateExtension,
        int cacheMaxEntries,
        int expressionCacheMaxEntries
) {
    public CompileOptions {
        if (mixinRecursionLimit < 1) {
            throw new IllegalArgumentException("mixin-recursion-limit must be positive, was " + mixinRecursionLimit);
        }
        if (cacheMaxEntries < 0) {
            throw new IllegalArgumentException("cache max-entries must not be negative, was " + cacheMaxEntries);
        }
        if (expressionCacheMaxEntries < 0) {
            throw new IllegalArgumentException("script parse-cache-max-entries must not be negative, was "
                    + expressionCacheMaxEntries);
        }
    }

    /**
     * @return The options from {@code application.conf} and {@code reference.conf}.
     */
    public static CompileOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * @param configFile A HOCON file with overrides.
     * @return The options from system properties, the file and {@code reference.conf}.
     */
    public static CompileOptions load(File configFile) {
        return fromConfig(ConfigLoader.load(configFile));
    }

    /**
     * @param config A configuration containing the {@code quill} tree.
     * @return The options.
     */
    public static CompileOptions fromConfig(Config config) {
        Config compiler = config.getConfig("quill.compiler");
        return new CompileOptions(
                compiler.getBoolean("pretty") ? RenderMode.PRETTY : RenderMode.COMPACT,
                compiler.getString("indent"),
                compiler.getInt("mixin-recursion-limit"),
                compiler.getString("template-extension"),
                config.getInt("quill.cache.max-entries"),
                config.getInt("quill.script.parse-cache-max-entries"));
    }

    public CompileOptions withMode(RenderMode mode) {
        return new CompileOptions(mode, indent, mixinRecursionLimit, templateExtension, cacheMaxEntries,
                expressionCacheMaxEntries);
    }

    public CompileOptions withMixinRecursionLimit(int limit) {
        return new CompileOptions(mode, indent, limit, templateExtension, cacheMaxEntries,
                expressionCacheMaxEntries);
    }
}
