package com.hostsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hostsentinel.core.model.Snapshot;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into a
 * {@link Snapshot}.
 *
 * <p>
 * Malformed messages, and messages without a source id, are logged and
 * dropped (returns {@code null}) so one bad agent cannot stop the pipeline.
 * </p>
 */
public class SnapshotDeserializationSchema implements DeserializationSchema<Snapshot> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public Snapshot deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            Snapshot snapshot = objectMapper().readValue(message, Snapshot.class);
            if (snapshot.getSourceId().isBlank()) {
                LOG.warn("Dropping snapshot without source id");
                return null;
            }
            return snapshot;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize snapshot - skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(Snapshot nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<Snapshot> getProducedType() {
        return TypeInformation.of(Snapshot.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
