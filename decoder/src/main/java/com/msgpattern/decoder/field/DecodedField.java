package com.msgpattern.decoder.field;

import java.util.Objects;

/**
 * A field value decoded from a raw token, tagged with its {@link FieldType}.
 *
 * <p>Numeric kinds are held unboxed. Timestamps use all 64 bits of a long as an
 * unsigned value; read them with {@link #getTimestamp()} and render them with
 * {@link Long#toUnsignedString(long)}.</p>
 */
public final class DecodedField {

    private final String name;
    private final FieldType type;
    private final String rawToken;
    private final long longValue;
    private final double doubleValue;
    private final String stringValue;

    private DecodedField(String name, FieldType type, String rawToken,
                         long longValue, double doubleValue, String stringValue) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.rawToken = rawToken;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
        this.stringValue = stringValue;
    }

    public static DecodedField ofInteger(String name, String rawToken, long value) {
        return new DecodedField(name, FieldType.INTEGER, rawToken, value, 0.0, null);
    }

    public static DecodedField ofBoolean(String name, String rawToken, boolean value) {
        return new DecodedField(name, FieldType.BOOLEAN, rawToken, value ? 1 : 0, 0.0, null);
    }

    public static DecodedField ofDouble(String name, String rawToken, double value) {
        return new DecodedField(name, FieldType.DOUBLE, rawToken, 0, value, null);
    }

    public static DecodedField ofString(String name, String rawToken) {
        return new DecodedField(name, FieldType.STRING, rawToken, 0, 0.0, Objects.requireNonNull(rawToken, "rawToken"));
    }

    public static DecodedField ofTimestamp(String name, String rawToken, long unsignedValue) {
        return new DecodedField(name, FieldType.TIMESTAMP, rawToken, unsignedValue, 0.0, null);
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    /**
     * Get the token this value was decoded from.
     */
    public String getRawToken() {
        return rawToken;
    }

    public long getLong() {
        requireType(FieldType.INTEGER);
        return longValue;
    }

    public boolean getBoolean() {
        requireType(FieldType.BOOLEAN);
        return longValue != 0;
    }

    public double getDouble() {
        requireType(FieldType.DOUBLE);
        return doubleValue;
    }

    public String getString() {
        requireType(FieldType.STRING);
        return stringValue;
    }

    /**
     * Get the timestamp as the raw 64 bits of an unsigned value.
     */
    public long getTimestamp() {
        requireType(FieldType.TIMESTAMP);
        return longValue;
    }

    /**
     * Get the value boxed: Long, Boolean, Double or String. Timestamps above
     * Long.MAX_VALUE come back as their negative two's-complement long.
     */
    public Object getValue() {
        return switch (type) {
            case INTEGER, TIMESTAMP -> longValue;
            case BOOLEAN -> longValue != 0;
            case DOUBLE -> doubleValue;
            case STRING -> stringValue;
        };
    }

    private void requireType(FieldType expected) {
        if (type != expected) {
            throw new IllegalStateException("Field '" + name + "' is " + type + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecodedField)) return false;
        DecodedField that = (DecodedField) o;
        return longValue == that.longValue
                && Double.compare(doubleValue, that.doubleValue) == 0
                && name.equals(that.name)
                && type == that.type
                && Objects.equals(stringValue, that.stringValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, longValue, doubleValue, stringValue);
    }

    @Override
    public String toString() {
        String value = type == FieldType.TIMESTAMP ? Long.toUnsignedString(longValue) : String.valueOf(getValue());
        return name + "=" + value + " (" + type + ")";
    }
}
