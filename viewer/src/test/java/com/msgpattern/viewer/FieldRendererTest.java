package com.msgpattern.viewer;

import com.msgpattern.decoder.field.DecodedField;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldRendererTest {

    private final FieldRenderer renderer = new FieldRenderer();

    @Test
    void rendersEachType() {
        assertEquals("-42", renderer.render(DecodedField.ofInteger("n", "-42", -42)));
        assertEquals("true", renderer.render(DecodedField.ofBoolean("ok", "5", true)));
        assertEquals("false", renderer.render(DecodedField.ofBoolean("ok", "0", false)));
        assertEquals("hello world", renderer.render(DecodedField.ofString("s", "hello world")));
        assertEquals("parsed_ts=1700000000", renderer.render(DecodedField.ofTimestamp("at", "1700000000", 1700000000L)));
    }

    @Test
    void timestampIsUnsigned() {
        assertEquals("parsed_ts=18446744073709551615", renderer.render(DecodedField.ofTimestamp("at", "-1", -1L)));
    }

    @Test
    void customTimestampPrefix() {
        assertEquals("@7", new FieldRenderer("@").render(DecodedField.ofTimestamp("at", "7", 7)));
    }

    @Test
    void doublesArePlainDecimals() {
        assertEquals("21.5", FieldRenderer.formatDouble(21.50));
        assertEquals("20", FieldRenderer.formatDouble(20.0));
        assertEquals("0", FieldRenderer.formatDouble(0.0));
        assertEquals("-0.001", FieldRenderer.formatDouble(-0.001));
        assertEquals("100000000000000000000", FieldRenderer.formatDouble(1e20));
    }

    @Test
    void specialDoubles() {
        assertEquals("nan", FieldRenderer.formatDouble(Double.NaN));
        assertEquals("inf", FieldRenderer.formatDouble(Double.POSITIVE_INFINITY));
        assertEquals("-inf", FieldRenderer.formatDouble(Double.NEGATIVE_INFINITY));
    }
}
