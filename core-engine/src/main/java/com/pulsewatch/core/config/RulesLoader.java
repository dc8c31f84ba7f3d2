package com.pulsewatch.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the Pulsewatch rules document ({@code rules.yml}) into a validated
 * {@link RulesConfig}.
 *
 * <h3>Where rules come from</h3>
 * <p>
 * {@link #load(String)} prefers an explicit path (normally the service's
 * {@code PULSEWATCH_RULES_PATH}), then {@value #ENV_RULES_PATH} when no path
 * is passed, and finally the bundled {@value #DEFAULT_RESOURCE} on the
 * classpath. Embedders can skip files entirely with {@link #fromString}.
 * </p>
 *
 * <h3>Failure modes</h3>
 * <ul>
 * <li>missing file or resource: {@link IllegalArgumentException}</li>
 * <li>YAML that does not map onto the rules model: {@link IllegalStateException}
 * naming the source</li>
 * <li>well-formed YAML with invalid rules or engine settings: the collected
 * error list from {@link RulesConfig#validate()}</li>
 * </ul>
 * An empty document yields engine defaults with no rules.
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Environment variable consulted when no explicit path is passed. */
    public static final String ENV_RULES_PATH = "PULSEWATCH_RULES_PATH";

    /** Bundled rules document on the classpath. */
    public static final String DEFAULT_RESOURCE = "rules.yml";

    private RulesLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Resolution
    // ---------------------------------------------------------------

    /**
     * Load from {@value #ENV_RULES_PATH}, falling back to the bundled rules.
     *
     * @return validated rules
     */
    public static RulesConfig load() {
        return load(null);
    }

    /**
     * Load from {@code path} when it names an existing file. A blank path
     * defers to {@value #ENV_RULES_PATH}; if neither resolves to a file the
     * bundled {@value #DEFAULT_RESOURCE} is used.
     *
     * @param path file system path, may be {@code null} or blank
     * @return validated rules
     */
    public static RulesConfig load(String path) {
        String candidate = isBlank(path) ? System.getenv(ENV_RULES_PATH) : path;
        if (!isBlank(candidate)) {
            Path file = Path.of(candidate);
            if (Files.isRegularFile(file)) {
                return fromFile(file);
            }
            LOG.warn("Rules path {} is not a readable file, using bundled {}", file, DEFAULT_RESOURCE);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    // ---------------------------------------------------------------
    // Sources
    // ---------------------------------------------------------------

    public static RulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "path must not be null");
        return fromFile(Path.of(path));
    }

    /**
     * @param file rules document on disk
     * @return validated rules
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or parsed
     */
    public static RulesConfig fromFile(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        try (InputStream in = Files.newInputStream(file)) {
            return parse(new Yaml(constructor()).load(in), file.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Rules file not found: " + file, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file " + file, e);
        } catch (YAMLException e) {
            throw malformed(file.toString(), e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return validated rules
     * @throws IllegalArgumentException if the resource is not on the classpath
     * @throws IllegalStateException    if the resource cannot be read or parsed
     */
    public static RulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        InputStream in = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Rules resource not found on classpath: " + resource);
        }
        String source = "classpath:" + resource;
        try (in) {
            return parse(new Yaml(constructor()).load(in), source);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + source, e);
        } catch (YAMLException e) {
            throw malformed(source, e);
        }
    }

    /**
     * Parse an inline rules document.
     *
     * @param yaml       document text
     * @param sourceName label used in log lines and error messages
     * @return validated rules
     */
    public static RulesConfig fromString(String yaml, String sourceName) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        try {
            return parse(new Yaml(constructor()).load(new StringReader(yaml)), sourceName);
        } catch (YAMLException e) {
            throw malformed(sourceName, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Constructor constructor() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Constructor(RulesConfig.class, options);
    }

    private static RulesConfig parse(RulesConfig parsed, String source) {
        RulesConfig config = parsed;
        if (config == null) {
            LOG.warn("Rules document {} is empty, running with engine defaults", source);
            config = new RulesConfig();
        }
        config.validate();
        LOG.info("Loaded rules from {}: {} aggregation, {} detection, {} alert rule(s)",
                source,
                config.getAggregationRules().size(),
                config.getDetectionRules().size(),
                config.getAlerts().size());
        return config;
    }

    private static IllegalStateException malformed(String source, YAMLException e) {
        return new IllegalStateException("Malformed rules document " + source + ": " + e.getMessage(), e);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
