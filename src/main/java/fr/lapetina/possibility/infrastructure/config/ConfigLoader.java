package fr.lapetina.possibility.infrastructure.config;

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
 * Loads {@link OrchestratorConfig} from YAML, file system first, then classpath.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(OrchestratorConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return the loaded configuration
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public OrchestratorConfig load() {
        OrchestratorConfig config = loadFromPath();
        validate(config);
        return config;
    }

    private OrchestratorConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString().replace('\\', '/');
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

    private OrchestratorConfig loadFromFile(Path path) {
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
    public OrchestratorConfig loadFromStream(InputStream inputStream) {
        OrchestratorConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private OrchestratorConfig parse(InputStream is, String source) {
        try {
            OrchestratorConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    static void validate(OrchestratorConfig config) {
        OrchestratorConfig.PoolConfig pool = config.getPool();
        if (pool.getMaxConcurrentConnections() < 1) {
            throw new ConfigurationException(
                    "pool.maxConcurrentConnections must be at least 1: " + pool.getMaxConcurrentConnections());
        }
        if (Integer.bitCount(pool.getRingBufferSize()) != 1) {
            throw new ConfigurationException("pool.ringBufferSize must be a power of 2: " + pool.getRingBufferSize());
        }
        if (config.getLifecycle().getMaxRetries() < 0) {
            throw new ConfigurationException("lifecycle.maxRetries must not be negative");
        }
        String pathTemplate = config.getEndpoint().getPathTemplate();
        if (pathTemplate == null || !pathTemplate.contains("{id}")) {
            throw new ConfigurationException("endpoint.pathTemplate must contain {id}: " + pathTemplate);
        }
    }

    /**
     * Creates a default configuration.
     */
    public static OrchestratorConfig createDefault() {
        return new OrchestratorConfig();
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
