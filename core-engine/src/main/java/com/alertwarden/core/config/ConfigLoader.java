package com.alertwarden.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Loads the alerting configuration document from YAML or JSON.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Formats</h3>
 * <p>
 * YAML is parsed with SnakeYAML (duplicate keys rejected), JSON with Jackson.
 * The format is picked from the file extension: {@code .json} is JSON,
 * anything else YAML. Both bind into the same {@link ConfigDocument}. JSON
 * exported from the alerting platform carries extra fields such as
 * {@code location}; Jackson ignores unknown properties, SnakeYAML rejects them.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * The {@code from*} methods validate the document with
 * {@link ConfigValidator} so that the engine <strong>fails fast</strong> on
 * an invalid document. The {@code read*} methods only parse.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ALERTING_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "alerting.yml";

    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Document syntax. */
    public enum Format {
        YAML, JSON;

        /**
         * @param fileName file or resource name
         * @return {@link #JSON} for {@code *.json}, {@link #YAML} otherwise
         */
        public static Format forName(String fileName) {
            return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".json") ? JSON : YAML;
        }
    }

    private ConfigLoader() {
        // utility class - not instantiable
    }

    // ---------------------------------------------------------------
    // Public API: parse and validate
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code ALERTING_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, fall back to {@code alerting.yml} on the classpath.</li>
     * </ol>
     *
     * @return validated configuration
     * @throws ConfigException if the document is malformed or invalid
     */
    public static EngineConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading alerting configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading alerting configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path file system path; must not be {@code null}
     * @return validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws ConfigException          if the document is malformed or invalid
     */
    public static EngineConfig fromFile(String path) {
        return validated(readFile(path));
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ConfigException          if the document is malformed or invalid
     */
    public static EngineConfig fromClasspath(String resource) {
        return validated(readClasspath(resource));
    }

    // ---------------------------------------------------------------
    // Public API: parse only
    // ---------------------------------------------------------------

    /**
     * Parse a document from the file system without validating it.
     *
     * @param path file system path; must not be {@code null}
     * @return raw document
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     * @throws ConfigException          if the document is malformed
     */
    public static ConfigDocument readFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            return parse(is, Format.forName(path));
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Alerting config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read alerting config file: " + path, e);
        }
    }

    /**
     * Parse a document from the classpath without validating it.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return raw document
     * @throws IllegalArgumentException if the resource does not exist
     * @throws ConfigException          if the document is malformed
     */
    public static ConfigDocument readClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, Format.forName(resource));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse a document held in memory.
     *
     * @param content document text; must not be {@code null}
     * @param format  document syntax
     * @return raw document
     * @throws ConfigException if the document is malformed
     */
    public static ConfigDocument readString(String content, Format format) {
        Objects.requireNonNull(content, "Config content must not be null");
        return parse(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), format);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ConfigDocument parse(InputStream is, Format format) {
        ConfigDocument document;
        try {
            if (format == Format.JSON) {
                document = JSON.readValue(is, ConfigDocument.class);
            } else {
                LoaderOptions options = new LoaderOptions();
                options.setAllowDuplicateKeys(false);
                Yaml yaml = new Yaml(new Constructor(ConfigDocument.class, options));
                document = yaml.load(is);
            }
        } catch (YAMLException e) {
            throw new ConfigException("Malformed YAML document: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed JSON document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read alerting configuration", e);
        }

        if (document == null) {
            LOG.warn("Alerting configuration document is empty");
            document = new ConfigDocument();
        }
        return document;
    }

    private static EngineConfig validated(ConfigDocument document) {
        EngineConfig config = ConfigValidator.validate(document);
        LOG.info("Loaded {} alert rule(s) and {} action group(s)",
                config.getRules().size(), config.getActionGroups().size());
        return config;
    }
}
