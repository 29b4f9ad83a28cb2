package io.streamgateway.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamgateway.json.spi.JsonCodec;
import io.streamgateway.json.spi.JsonException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson implementation of JsonCodec.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with a default ObjectMapper. Integers too large for a long are read
     * as {@link java.math.BigInteger}.
     */
    public JacksonJsonCodec() {
        this.mapper = new ObjectMapper(new JsonFactory());
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to string", e);
        }
    }

    @Override
    public Map<String, Object> readObject(byte[] data) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Cannot read a JSON object from empty data");
        }
        try {
            Map<String, Object> value = mapper.readValue(data, OBJECT_TYPE);
            if (value == null) {
                throw new JsonException("Expected a JSON object but found null");
            }
            return value;
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to a JSON object", e);
        }
    }
}
