package com.msgpattern.decoder.schema;

/**
 * Exception thrown when a schema definition line cannot be turned into a
 * {@link MessagePattern}.
 */
public class SchemaParseException extends RuntimeException {

    /**
     * Why a definition line was rejected.
     */
    public enum Reason {
        /** Too few segments, a non-numeric id, or a field definition without name or type. */
        MALFORMED_DEFINITION,
        /** A field definition names a type the registry does not know. */
        UNKNOWN_FIELD_TYPE
    }

    private final Reason reason;
    private final String definition;
    private final int lineNumber;

    public SchemaParseException(Reason reason, String definition, int lineNumber, String message) {
        super(message + " (line " + lineNumber + ": " + definition + ")");
        this.reason = reason;
        this.definition = definition;
        this.lineNumber = lineNumber;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Get the rejected definition line.
     */
    public String getDefinition() {
        return definition;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
