package com.ryuqq.maintenance.adapter.inmemory.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.maintenance.core.spi.ManifestIndexException;

import java.io.IOException;

/**
 * JSON codec for manifest payloads.
 *
 * <p>Payloads are plain records and value objects without serialization annotations.
 * Durations are written as ISO-8601 text ({@code "PT1H"}). Unknown fields are ignored on
 * read so that entries written by a newer client still load.</p>
 *
 * <p><strong>Example document:</strong></p>
 * <pre>
 * {
 *   "owner" : "alice@host-a",
 *   "quickCycle" : { "enabled" : true, "interval" : "PT1H" },
 *   "fullCycle" : { "enabled" : true, "interval" : "PT24H" },
 *   "logRetention" : { "maxCount" : 10000, "maxAge" : "PT720H", "maxTotalSize" : 1073741824 }
 * }
 * </pre>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public final class ManifestCodec {

    private final ObjectMapper mapper;

    /**
     * Creates a codec with {@link #defaultMapper()}.
     */
    public ManifestCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a codec with a custom mapper.
     *
     * @param mapper the object mapper
     * @throws IllegalArgumentException if mapper is null
     */
    public ManifestCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * Mapper used for manifest payloads.
     *
     * @return a new configured mapper
     */
    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    /**
     * Serializes a payload.
     *
     * @param payload the value to encode
     * @return UTF-8 JSON bytes
     * @throws ManifestIndexException if the value cannot be serialized
     */
    public byte[] encode(Object payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new ManifestIndexException("Failed to encode manifest payload of type " + payload.getClass().getName(), e);
        }
    }

    /**
     * Deserializes a payload.
     *
     * @param payload UTF-8 JSON bytes
     * @param type target type
     * @param <T> target type
     * @return the decoded value
     * @throws ManifestIndexException if the bytes are not a valid document for {@code type}
     */
    public <T> T decode(byte[] payload, Class<T> type) {
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new ManifestIndexException("Failed to decode manifest payload as " + type.getSimpleName(), e);
        }
    }
}
