package com.driftsentinel.scheduler.app;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON export of check results, reports, safety events and alert details.
 *
 * <p>
 * Property names are snake_case, timestamps ISO-8601 and {@code null}
 * properties are omitted. A value that cannot be serialized is logged and
 * yields an empty payload.
 * </p>
 */
public final class JsonSupport {

    private static final Logger LOG = LoggerFactory.getLogger(JsonSupport.class);

    private static final ObjectMapper MAPPER = newMapper();

    private JsonSupport() {
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {}: {}", typeOf(value), e.getMessage(), e);
            return "";
        }
    }

    public static byte[] toJsonBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {}: {}", typeOf(value), e.getMessage(), e);
            return new byte[0];
        }
    }

    /**
     * @return the shared, fully configured mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
