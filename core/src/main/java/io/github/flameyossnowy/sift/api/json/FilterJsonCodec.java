package io.github.flameyossnowy.sift.api.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.flameyossnowy.sift.api.exceptions.json.JacksonJsonLocation;
import io.github.flameyossnowy.sift.api.exceptions.json.JsonProcessException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Jackson-backed codec for search request payloads.
 * <p>
 * Unknown properties are ignored, since requests usually carry paging and sorting keys next
 * to the filter. Nullable wrappers and {@code java.time} values are supported out of the box.
 */
public class FilterJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    public FilterJsonCodec() {
        this(defaultMapper());
    }

    public FilterJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Contract(" -> new")
    public static @NotNull ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new NullableModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public <T> T deserialize(String json, Class<T> targetType) {
        try {
            return mapper.readValue(json, targetType);
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(
                "Cannot bind " + targetType.getSimpleName() + ": " + e.getOriginalMessage(),
                e,
                JacksonJsonLocation.from(e.getLocation())
            );
        }
    }

    @Override
    public <T> String serialize(T value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getOriginalMessage(), e, JacksonJsonLocation.from(e.getLocation()));
        }
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}
