package com.alertwarden.service;

import com.alertwarden.core.model.NotificationPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts notification payloads and diagnostics views to JSON, with
 * ISO-8601 timestamps.
 */
public class PayloadSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(PayloadSerializer.class);

    private final ObjectMapper mapper;

    public PayloadSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @return the JSON bytes, or an empty array if the payload cannot be
     *         serialized
     */
    public byte[] serialize(NotificationPayload payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize notification payload: {}", e.getMessage(), e);
            return new byte[0];
        }
    }

    /**
     * Serialize any view object.
     *
     * @throws JsonProcessingException if the value cannot be serialized
     */
    public byte[] toJson(Object value) throws JsonProcessingException {
        return mapper.writeValueAsBytes(value);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}
