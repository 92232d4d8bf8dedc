package com.hostsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} for the alert command topic.
 *
 * <p>
 * Commands with an unknown action or a malformed key are logged and dropped.
 * </p>
 */
public class AlertCommandDeserializationSchema implements DeserializationSchema<AlertCommand> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertCommandDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public AlertCommand deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, AlertCommand.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize alert command - skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(AlertCommand nextElement) {
        return false;
    }

    @Override
    public TypeInformation<AlertCommand> getProducedType() {
        return TypeInformation.of(AlertCommand.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
