package org.quill.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the compiler configuration from layered sources. The first source that sets a key wins:
 * <ol>
 *     <li>Java system properties ({@code -Dquill.compiler.pretty=true})</li>
 *     <li>The given configuration file, if it exists</li>
 *     <li>{@code reference.conf} on the class path</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param configFile A HOCON file with overrides, may be null.
     * @return The resolved configuration.
     */
    public static Config load(File configFile) {
        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            log.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.empty();
        }

        return ConfigFactory.systemProperties()
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
