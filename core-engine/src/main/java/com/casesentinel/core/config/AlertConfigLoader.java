package com.casesentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates an {@link AlertConfig} from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>Built-in defaults from {@link AlertConfig#defaults()}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*} method converts the parsed document into an immutable
 * {@link AlertConfig}, so an invalid file fails here and not mid-run.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AlertConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ALERT_CONFIG_PATH";

    /** Classpath resource consulted when no path is configured. */
    public static final String DEFAULT_RESOURCE = "alert-config.yml";

    private AlertConfigLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws ConfigurationException if the resolved source is invalid
     */
    public static AlertConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading alert configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (AlertConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading alert configuration from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No alert configuration found, using built-in defaults");
        return AlertConfig.defaults();
    }

    /**
     * @param path path to a YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws ConfigurationException   if reading or validation fails
     */
    public static AlertConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Alert config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read alert config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ConfigurationException   if reading or validation fails
     */
    public static AlertConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AlertConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AlertConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AlertConfigDocument.class, options));

        AlertConfigDocument document;
        try {
            document = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed alert configuration: " + e.getMessage(), e);
        }

        if (document == null) {
            LOG.warn("Alert configuration is empty, using built-in defaults");
            return AlertConfig.defaults();
        }

        AlertConfig config = document.toAlertConfig();
        LOG.info("Loaded alert configuration: {}", config);
        return config;
    }
}
