package fr.lapetina.configstore.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the bootstrap configuration.
 *
 * Supports:
 * - Loading from the file system, then from the classpath
 * - Loading from an arbitrary stream
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public StoreConfig load() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private StoreConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public static StoreConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private static StoreConfig parse(InputStream is, String origin) {
        // Yaml instances are not thread-safe
        Yaml yaml = new Yaml(new Constructor(StoreConfig.class, new LoaderOptions()));
        try {
            StoreConfig config = yaml.load(is);
            return config != null ? config : new StoreConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Creates a default configuration.
     */
    public static StoreConfig createDefault() {
        return new StoreConfig();
    }

    /**
     * Exception for configuration errors.
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
