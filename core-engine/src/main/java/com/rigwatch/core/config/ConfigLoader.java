package com.rigwatch.core.config;

import com.rigwatch.core.model.MetricRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reads the pipeline's tuning from YAML into a validated {@link PipelineConfig}.
 *
 * <p>
 * {@link #load()} prefers the file named by {@value #ENV_CONFIG_PATH}, then
 * the bundled {@value #DEFAULT_RESOURCE}, then the built-in defaults. An
 * empty document also yields the defaults. Every source is validated before
 * it is returned, and errors name the source they came from.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable naming a YAML file that overrides the bundled config. */
    public static final String ENV_CONFIG_PATH = "RIGWATCH_CONFIG_PATH";

    /** Bundled classpath resource. */
    public static final String DEFAULT_RESOURCE = "pipeline.yml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Resolve the configuration for this process.
     *
     * @return validated configuration
     * @throws IllegalStateException if the chosen source is invalid
     */
    public static PipelineConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank()) {
            Path path = Path.of(envPath);
            if (Files.isRegularFile(path)) {
                return fromFile(path);
            }
            LOG.warn("{} points to a missing file ({}), ignoring it", ENV_CONFIG_PATH, envPath);
        }
        if (ConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.info("No {} on classpath, running with built-in defaults", DEFAULT_RESOURCE);
            return checked(new PipelineConfig(), "built-in defaults");
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if it cannot be read, parsed or validated
     */
    public static PipelineConfig fromFile(String path) {
        return fromFile(Path.of(Objects.requireNonNull(path, "Config file path must not be null")));
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if it cannot be read, parsed or validated
     */
    public static PipelineConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        String source = "file " + path;
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, source);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + source, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if it cannot be read, parsed or validated
     */
    public static PipelineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        String source = "classpath:" + resource;
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (in) {
            return parse(in, source);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + source, e);
        }
    }

    private static PipelineConfig parse(InputStream in, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        PipelineConfig config;
        try {
            config = new Yaml(new Constructor(PipelineConfig.class, options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed pipeline config in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Pipeline config in {} is empty, using defaults", source);
            config = new PipelineConfig();
        }
        return checked(config, source);
    }

    private static PipelineConfig checked(PipelineConfig config, String source) {
        try {
            config.validate();
        } catch (IllegalStateException e) {
            LOG.error("Rejected pipeline config from {}: {}", source, e.getMessage());
            throw e;
        }
        LOG.info("Pipeline config from {}: window={} (min {}), z>{}, vote>={}, dedup={}s, rules=[{}]",
                source,
                config.getWindowSize(),
                config.getMinWindow(),
                config.getZscoreThreshold(),
                config.getVoteThreshold(),
                config.getDedupWindowSeconds(),
                config.getMetricRules().stream().map(MetricRule::getMetric).collect(Collectors.joining(", ")));
        return config;
    }
}
