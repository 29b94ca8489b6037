package com.tessera.database.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tessera.database.exception.DatabaseException;
import java.util.Map;
import org.bson.types.ObjectId;

/**
 * JSON conversion for model output and the {@code json}/{@code array} casts.
 *
 * <p>Dates are written as ISO-8601 strings and {@link ObjectId}s as their hex form.
 */
public final class ModelJson {

    private static final ObjectMapper MAPPER = createMapper();

    private ModelJson() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new SimpleModule("tessera-bson").addSerializer(ObjectId.class, ToStringSerializer.instance))
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @throws ModelJsonException if the value cannot be written
     */
    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ModelJsonException("Failed to write JSON", e);
        }
    }

    /**
     * Parses any JSON value: objects become {@code Map}, arrays {@code List}, numbers
     * {@code Integer}/{@code Long}/{@code Double}.
     *
     * @throws ModelJsonException if the text is not valid JSON
     */
    public static Object read(String json) {
        try {
            return MAPPER.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new ModelJsonException("Failed to read JSON", e);
        }
    }

    /** Shared mapper used for json casts and {@link Model#toJson()}. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /** JSON conversion of an attribute or model failed. */
    public static class ModelJsonException extends DatabaseException {
        public ModelJsonException(String message, Throwable cause) {
            super(message, null, "json", Map.of(), cause);
        }
    }
}
