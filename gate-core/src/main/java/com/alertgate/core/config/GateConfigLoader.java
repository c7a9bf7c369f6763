package com.alertgate.core.config;

import com.alertgate.core.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link GateConfig} from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * YAML is decoded into plain maps first and then converted by
 * {@link GateConfig#fromMap(Map)}, the same path used for configuration that
 * arrives as JSON from other collaborators.
 * </p>
 *
 * @since 1.0.0
 */
public final class GateConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(GateConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "GATE_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "alert-gate.yml";

    private GateConfigLoader() {
        // utility class
    }

    /**
     * Load using {@value #ENV_CONFIG_PATH} if it points at an existing file,
     * otherwise the classpath resource {@value #DEFAULT_RESOURCE}.
     *
     * @return parsed and validated configuration
     * @throws ConfigurationException if the configuration is invalid
     */
    public static GateConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading gate config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading gate config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file path; must not be {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws ConfigurationException   if reading, parsing or validation fails
     */
    public static GateConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parse(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ConfigurationException   if reading, parsing or validation fails
     */
    public static GateConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = GateConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static GateConfig parse(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));

        Object root;
        try {
            root = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML: " + e.getMessage(), e);
        }
        if (root == null) {
            LOG.warn("Gate configuration is empty, using defaults");
            return GateConfig.empty();
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Gate configuration root must be a map");
        }

        GateConfig config = GateConfig.fromMap(ConfigValues.toStringKeys(map));
        LOG.info("Loaded gate config with {} rule(s), storm={}", config.getRules().size(), config.getStorm());
        return config;
    }
}
