package io.github.flameyossnowy.sift.api.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.github.flameyossnowy.sift.api.nullable.*;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Jackson module for the nullable wrappers.
 * <p>
 * A JSON {@code null} binds to an absent wrapper and any other value to a present one, so a
 * filter can tell "sent as null" apart from "sent as zero". Absent wrappers are written as
 * {@code null}. A property missing from the payload binds to an absent wrapper on records,
 * through the deserializer's null value, and stays {@code null} on plain classes.
 */
public final class NullableModule extends SimpleModule {

    public NullableModule() {
        super("SiftNullableModule");

        register(NullString.class, String.class, NullString::of, NullString::empty);
        register(NullLong.class, Long.class, NullLong::of, NullLong::empty);
        register(NullInteger.class, Integer.class, NullInteger::of, NullInteger::empty);
        register(NullShort.class, Short.class, NullShort::of, NullShort::empty);
        register(NullByte.class, Byte.class, NullByte::of, NullByte::empty);
        register(NullDouble.class, Double.class, NullDouble::of, NullDouble::empty);
        register(NullBoolean.class, Boolean.class, NullBoolean::of, NullBoolean::empty);
        register(NullDecimal.class, BigDecimal.class, NullDecimal::of, NullDecimal::empty);
        register(NullDate.class, LocalDate.class, NullDate::of, NullDate::empty);
        register(NullTime.class, LocalTime.class, NullTime::of, NullTime::empty);
        register(NullDateTime.class, LocalDateTime.class, NullDateTime::of, NullDateTime::empty);
    }

    private <W extends NullableValue<V>, V> void register(
        Class<W> wrapperType,
        Class<V> valueType,
        Function<V, W> present,
        Supplier<W> absent
    ) {
        addSerializer(wrapperType, new NullableSerializer<>());
        addDeserializer(wrapperType, new NullableDeserializer<>(valueType, present, absent));
    }

    // ==================== Serializer ====================

    private static final class NullableSerializer<W extends NullableValue<?>> extends JsonSerializer<W> {
        @Override
        public void serialize(W value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            if (!value.isPresent()) {
                gen.writeNull();
                return;
            }
            serializers.defaultSerializeValue(value.get(), gen);
        }
    }

    // ==================== Deserializer ====================

    private static final class NullableDeserializer<W extends NullableValue<V>, V> extends JsonDeserializer<W> {
        private final Class<V> valueType;
        private final Function<V, W> present;
        private final Supplier<W> absent;

        private NullableDeserializer(Class<V> valueType, Function<V, W> present, Supplier<W> absent) {
            this.valueType = valueType;
            this.present = present;
            this.absent = absent;
        }

        @Override
        public W deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            V value = ctxt.readValue(p, valueType);
            return value == null ? absent.get() : present.apply(value);
        }

        @Override
        public W getNullValue(DeserializationContext ctxt) {
            return absent.get();
        }
    }
}
