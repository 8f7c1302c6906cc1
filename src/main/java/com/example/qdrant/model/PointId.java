package com.example.qdrant.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Identifier of a Qdrant point: either an unsigned 64-bit integer or a UUID string.
 *
 * On the wire the id is a bare JSON number or a bare JSON string, so the variant
 * is recovered from the token type when decoding.
 */
@JsonSerialize(using = PointId.Serializer.class)
@JsonDeserialize(using = PointId.Deserializer.class)
public final class PointId {

    private final Long num;     // unsigned, read with Long.toUnsignedString
    private final String uuid;

    private PointId(Long num, String uuid) {
        this.num = num;
        this.uuid = uuid;
    }

    /**
     * Numeric id. The value is interpreted as unsigned, so {@code -1L} stands for 2^64-1.
     */
    public static PointId of(long num) {
        return new PointId(num, null);
    }

    public static PointId of(String uuid) {
        Objects.requireNonNull(uuid, "uuid");
        return new PointId(null, uuid);
    }

    public boolean isNumeric() {
        return num != null;
    }

    public long num() {
        if (num == null) {
            throw new IllegalStateException("Point id '" + uuid + "' is not numeric");
        }
        return num;
    }

    public String uuid() {
        if (uuid == null) {
            throw new IllegalStateException("Point id " + this + " is not a uuid");
        }
        return uuid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PointId)) return false;
        PointId other = (PointId) o;
        return Objects.equals(num, other.num) && Objects.equals(uuid, other.uuid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(num, uuid);
    }

    /**
     * Bare value, the same text used as a path segment when fetching a single point.
     */
    @Override
    public String toString() {
        return num != null ? Long.toUnsignedString(num) : uuid;
    }

    static final class Serializer extends JsonSerializer<PointId> {

        @Override
        public void serialize(PointId id, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (!id.isNumeric()) {
                gen.writeString(id.uuid);
            } else if (id.num >= 0) {
                gen.writeNumber(id.num);
            } else {
                gen.writeNumber(new BigInteger(Long.toUnsignedString(id.num)));
            }
        }
    }

    static final class Deserializer extends JsonDeserializer<PointId> {

        private static final BigInteger MAX_UNSIGNED = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

        @Override
        public PointId deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_NUMBER_INT) {
                BigInteger value = p.getBigIntegerValue();
                if (value.signum() < 0 || value.compareTo(MAX_UNSIGNED) > 0) {
                    return ctxt.reportInputMismatch(PointId.class,
                            "Point id %s is outside the unsigned 64-bit range", value);
                }
                return PointId.of(value.longValue());
            }
            if (token == JsonToken.VALUE_STRING) {
                return PointId.of(p.getText());
            }
            return (PointId) ctxt.handleUnexpectedToken(PointId.class, p);
        }
    }
}
