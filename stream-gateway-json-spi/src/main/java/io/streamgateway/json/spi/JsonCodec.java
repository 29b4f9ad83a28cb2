package io.streamgateway.json.spi;

import java.util.Map;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries.
 *
 * <p>The gateway treats backend payloads as opaque; this codec is only used for its own control
 * and data plane envelopes and for reading structured backend errors.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes a JSON object into an insertion-ordered map.
     * @param data JSON bytes (must be a JSON object)
     * @return field map
     * @throws JsonException if the data is not a JSON object
     */
    Map<String, Object> readObject(byte[] data) throws JsonException;
}
