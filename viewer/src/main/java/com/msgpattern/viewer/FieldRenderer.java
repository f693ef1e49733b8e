package com.msgpattern.viewer;

import com.msgpattern.decoder.field.DecodedField;

import java.math.BigDecimal;

/**
 * Renders decoded field values as text.
 *
 * <ul>
 *   <li>INTEGER - signed decimal</li>
 *   <li>BOOLEAN - {@code true} or {@code false}</li>
 *   <li>DOUBLE - plain decimal without exponent or trailing zeros, or
 *       {@code nan}, {@code inf}, {@code -inf}</li>
 *   <li>STRING - the raw token</li>
 *   <li>TIMESTAMP - unsigned decimal after the timestamp prefix</li>
 * </ul>
 *
 * <p>Output does not depend on the default locale.</p>
 */
public class FieldRenderer {

    public static final String DEFAULT_TIMESTAMP_PREFIX = "parsed_ts=";

    private final String timestampPrefix;

    public FieldRenderer() {
        this(DEFAULT_TIMESTAMP_PREFIX);
    }

    public FieldRenderer(String timestampPrefix) {
        this.timestampPrefix = timestampPrefix;
    }

    public String render(DecodedField field) {
        switch (field.getType()) {
            case INTEGER:
                return Long.toString(field.getLong());
            case BOOLEAN:
                return Boolean.toString(field.getBoolean());
            case DOUBLE:
                return formatDouble(field.getDouble());
            case STRING:
                return field.getString();
            case TIMESTAMP:
                return timestampPrefix + Long.toUnsignedString(field.getTimestamp());
            default:
                throw new IllegalStateException("No rendering for " + field.getType());
        }
    }

    public static String formatDouble(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
    }

    public String getTimestampPrefix() {
        return timestampPrefix;
    }
}
