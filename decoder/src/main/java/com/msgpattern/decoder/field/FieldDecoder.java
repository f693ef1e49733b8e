package com.msgpattern.decoder.field;

/**
 * Converts one raw text token into a {@link DecodedField} according to a declared type.
 *
 * <p>Numeric parsing follows one of two policies:</p>
 * <ul>
 *   <li><b>lenient</b> (default) - the longest valid numeric prefix is used and a
 *       token without one decodes to zero, see {@link LenientNumbers}. Numeric
 *       decoding never fails in this mode.</li>
 *   <li><b>strict</b> - a numeric token must be a valid number as a whole,
 *       otherwise {@link FieldDecodeException.Reason#MALFORMED_NUMBER} is thrown.</li>
 * </ul>
 *
 * <p>Booleans are parsed as integers: non-zero is {@code true}. Strings pass through
 * unmodified. Timestamps are unsigned integers with no calendar interpretation.</p>
 *
 * <p>Instances hold no mutable state and may be shared between threads.</p>
 */
public final class FieldDecoder {

    private static final FieldDecoder LENIENT = new FieldDecoder(true);
    private static final FieldDecoder STRICT = new FieldDecoder(false);

    private final boolean lenientNumbers;

    private FieldDecoder(boolean lenientNumbers) {
        this.lenientNumbers = lenientNumbers;
    }

    public static FieldDecoder lenient() {
        return LENIENT;
    }

    public static FieldDecoder strict() {
        return STRICT;
    }

    public static FieldDecoder of(boolean lenientNumbers) {
        return lenientNumbers ? LENIENT : STRICT;
    }

    public boolean isLenientNumbers() {
        return lenientNumbers;
    }

    /**
     * Decode a token.
     *
     * @param fieldName the declared field name, carried into the result
     * @param rawToken the token text
     * @param type the declared type
     * @return the decoded value
     * @throws FieldDecodeException if the type is unsupported, or the token is not
     *         a valid number under the strict policy
     */
    public DecodedField decode(String fieldName, String rawToken, FieldType type) {
        if (type == null) {
            throw new FieldDecodeException(FieldDecodeException.Reason.UNSUPPORTED_TYPE,
                    fieldName, rawToken, "no field type declared");
        }

        switch (type) {
            case INTEGER:
                checkInteger(fieldName, rawToken, type);
                return DecodedField.ofInteger(fieldName, rawToken, LenientNumbers.parseLong(rawToken));
            case BOOLEAN:
                checkInteger(fieldName, rawToken, type);
                return DecodedField.ofBoolean(fieldName, rawToken, LenientNumbers.parseLong(rawToken) != 0);
            case DOUBLE:
                if (!lenientNumbers && !LenientNumbers.isDecimal(rawToken)) {
                    throw malformed(fieldName, rawToken, type);
                }
                return DecodedField.ofDouble(fieldName, rawToken, LenientNumbers.parseDouble(rawToken));
            case STRING:
                return DecodedField.ofString(fieldName, rawToken);
            case TIMESTAMP:
                checkInteger(fieldName, rawToken, type);
                if (!lenientNumbers && rawToken.strip().startsWith("-")) {
                    throw malformed(fieldName, rawToken, type);
                }
                return DecodedField.ofTimestamp(fieldName, rawToken, LenientNumbers.parseUnsignedLong(rawToken));
            default:
                throw new FieldDecodeException(FieldDecodeException.Reason.UNSUPPORTED_TYPE,
                        fieldName, rawToken, "field type " + type + " not supported");
        }
    }

    private void checkInteger(String fieldName, String rawToken, FieldType type) {
        if (!lenientNumbers && !LenientNumbers.isInteger(rawToken)) {
            throw malformed(fieldName, rawToken, type);
        }
    }

    private static FieldDecodeException malformed(String fieldName, String rawToken, FieldType type) {
        return new FieldDecodeException(FieldDecodeException.Reason.MALFORMED_NUMBER,
                fieldName, rawToken, "not a valid " + type.getSchemaName());
    }

    @Override
    public String toString() {
        return "FieldDecoder{lenientNumbers=" + lenientNumbers + '}';
    }
}
