package com.msgpattern.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Arrays;
import java.util.List;

/**
 * Loads the settings for a decode run.
 *
 * <p>Sources are layered, later ones overriding earlier ones:</p>
 * <ol>
 *   <li>reference.conf from every module on the classpath (defaults)</li>
 *   <li>application.conf from the classpath</li>
 *   <li>the files named with {@code --config}, in order</li>
 *   <li>system properties, so {@code -Dmsgpattern.decoder.separator=|} wins</li>
 * </ol>
 *
 * <pre>{@code
 * Config config = ConfigLoader.load("site.conf", "override.conf");
 * DecoderConfig decoderConfig = DecoderConfig.fromConfig(config.getConfig("msgpattern"));
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    public static Config load(String... configFiles) {
        return load(Arrays.asList(configFiles));
    }

    /**
     * Load and resolve the layered configuration.
     *
     * @param configFiles files on disk, or classpath resources if no such file exists
     * @return the merged, resolved configuration
     * @throws ConfigurationException if a file is missing or cannot be parsed
     */
    public static Config load(List<String> configFiles) {
        Config config = ConfigFactory.defaultApplication()
                .withFallback(ConfigFactory.defaultReference());

        for (String path : configFiles) {
            config = parse(path).withFallback(config);
            log.info("Loaded config file: {}", path);
        }

        return ConfigFactory.systemProperties().withFallback(config).resolve();
    }

    private static Config parse(String path) {
        File file = new File(path);
        try {
            if (file.exists()) {
                return ConfigFactory.parseFile(file);
            }
            Config resource = ConfigFactory.parseResources(path);
            if (!resource.isEmpty()) {
                return resource;
            }
        } catch (ConfigException e) {
            throw new ConfigurationException("Failed to parse config file: " + path, e);
        }
        throw new ConfigurationException("Config file not found: " + path);
    }

    /**
     * Thrown when a config file named on the command line cannot be used.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
