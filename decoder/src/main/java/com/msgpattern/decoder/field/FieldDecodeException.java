package com.msgpattern.decoder.field;

/**
 * Exception thrown when a single raw token cannot be decoded into its declared type.
 *
 * <p>Decoding failures are local to one field: callers log them and carry on
 * with the remaining fields of the message.</p>
 */
public class FieldDecodeException extends RuntimeException {

    /**
     * Why a token could not be decoded.
     */
    public enum Reason {
        /** The declared type has no decoder. */
        UNSUPPORTED_TYPE,
        /** Strict numeric parsing rejected the token. */
        MALFORMED_NUMBER
    }

    private final Reason reason;
    private final String fieldName;
    private final String rawToken;

    public FieldDecodeException(Reason reason, String fieldName, String rawToken, String message) {
        super("Cannot decode field '" + fieldName + "' from '" + rawToken + "': " + message);
        this.reason = reason;
        this.fieldName = fieldName;
        this.rawToken = rawToken;
    }

    public Reason getReason() {
        return reason;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getRawToken() {
        return rawToken;
    }
}
