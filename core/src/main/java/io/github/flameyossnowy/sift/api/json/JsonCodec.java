package io.github.flameyossnowy.sift.api.json;

/**
 * Binds filter objects to and from their request representation.
 */
public interface JsonCodec {

    <T> T deserialize(String json, Class<T> targetType);

    <T> String serialize(T value);
}
