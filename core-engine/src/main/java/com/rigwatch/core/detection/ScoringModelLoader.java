package com.rigwatch.core.detection;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads a {@link LogisticScoringModel} from its JSON export:
 *
 * <pre>
 * { "intercept": -4.0, "coefficients": { "temperature_z_score": 1.2, ... } }
 * </pre>
 *
 * @since 1.0.0
 */
public final class ScoringModelLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringModelLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);

    private ScoringModelLoader() {
        // utility class
    }

    /**
     * @param path file system path of the JSON model
     * @return the loaded model
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or parsed
     */
    public static LogisticScoringModel fromFile(String path) {
        Objects.requireNonNull(path, "Model file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parse(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Model file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read model file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name of the JSON model
     * @return the loaded model
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the resource cannot be read or parsed
     */
    public static LogisticScoringModel fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ScoringModelLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static LogisticScoringModel parse(InputStream is, String source) throws IOException {
        LogisticScoringModel model = MAPPER.readValue(is, LogisticScoringModel.class);
        if (model.getCoefficients().isEmpty()) {
            throw new IllegalStateException("Model " + source + " defines no coefficients");
        }
        LOG.info("Loaded scoring model from {} with {} coefficient(s)", source, model.getCoefficients().size());
        return model;
    }
}
