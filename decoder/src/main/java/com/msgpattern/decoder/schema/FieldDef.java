package com.msgpattern.decoder.schema;

import com.msgpattern.decoder.field.FieldType;

import java.util.Objects;

/**
 * A named, typed field declared in a message pattern.
 */
public final class FieldDef {

    private final String name;
    private final FieldType type;

    public FieldDef(String name, FieldType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() { return name; }
    public FieldType getType() { return type; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldDef)) return false;
        FieldDef that = (FieldDef) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type.getSchemaName();
    }
}
