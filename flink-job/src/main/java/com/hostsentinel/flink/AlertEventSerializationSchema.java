package com.hostsentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts {@link AlertEvent} into
 * JSON bytes for the alerts topic. Dates are written as ISO-8601 strings.
 */
public class AlertEventSerializationSchema implements SerializationSchema<AlertEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertEventSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(AlertEvent event) {
        try {
            return objectMapper().writeValueAsBytes(event);
        } catch (Exception e) {
            LOG.error("Failed to serialize alert event: {}", e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
