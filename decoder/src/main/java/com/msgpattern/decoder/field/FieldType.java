package com.msgpattern.decoder.field;

/**
 * Scalar types a message field can be declared with.
 *
 * <p>The set is closed. Each constant carries the name used for it in schema
 * definition lines; the mapping from those names back to constants lives in
 * {@link FieldTypeRegistry}.</p>
 */
public enum FieldType {

    INTEGER("int"),
    BOOLEAN("bool"),
    DOUBLE("double"),
    STRING("string"),
    TIMESTAMP("ts");

    private final String schemaName;

    FieldType(String schemaName) {
        this.schemaName = schemaName;
    }

    /**
     * Get the name this type is declared with in schema definitions.
     *
     * @return the schema type name, e.g. "int" or "ts"
     */
    public String getSchemaName() {
        return schemaName;
    }

    /**
     * Check if tokens of this type go through numeric parsing.
     */
    public boolean isNumeric() {
        return this != STRING;
    }
}
