package com.rigwatch.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rigwatch.core.model.TelemetryEvent;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes to a
 * {@link TelemetryEvent}.
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}), so a
 * single bad record does not fail the job. Semantic validation (finite
 * metrics, non-negative timestamp) happens later in the stream processor.
 * </p>
 */
public class TelemetryEventDeserializationSchema implements DeserializationSchema<TelemetryEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TelemetryEventDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public TelemetryEvent deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, TelemetryEvent.class);
        } catch (IOException e) {
            LOG.warn("Failed to deserialize telemetry event, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(TelemetryEvent nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<TelemetryEvent> getProducedType() {
        return TypeInformation.of(TelemetryEvent.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
        }
        return mapper;
    }
}
