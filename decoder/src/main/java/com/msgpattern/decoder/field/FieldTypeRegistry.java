package com.msgpattern.decoder.field;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup table from schema type names to {@link FieldType}s.
 *
 * <p>A registry is built once at startup and handed to every component that
 * needs to resolve type names. Nothing consults a global table.</p>
 *
 * <pre>{@code
 * FieldTypeRegistry registry = FieldTypeRegistry.standard();
 * registry.typeOf("ts");      // Optional[TIMESTAMP]
 * registry.typeOf("float");   // Optional.empty()
 * }</pre>
 */
public final class FieldTypeRegistry {

    private static final FieldTypeRegistry STANDARD = new FieldTypeRegistry(defaultNames());

    private final Map<String, FieldType> typesByName;
    private final Map<FieldType, String> namesByType;

    private FieldTypeRegistry(Map<String, FieldType> typesByName) {
        this.typesByName = Collections.unmodifiableMap(new LinkedHashMap<>(typesByName));
        Map<FieldType, String> reverse = new EnumMap<>(FieldType.class);
        typesByName.forEach((name, type) -> reverse.putIfAbsent(type, name));
        this.namesByType = Collections.unmodifiableMap(reverse);
    }

    /**
     * Get the registry holding the standard type names
     * ({@code int, bool, double, string, ts}).
     */
    public static FieldTypeRegistry standard() {
        return STANDARD;
    }

    /**
     * Create a registry from an explicit name table.
     *
     * @param typesByName type name to field type; names are matched case-sensitively
     * @return the registry
     * @throws IllegalArgumentException if the table is empty or holds a blank name
     */
    public static FieldTypeRegistry of(Map<String, FieldType> typesByName) {
        if (typesByName.isEmpty()) {
            throw new IllegalArgumentException("Field type registry must not be empty");
        }
        for (String name : typesByName.keySet()) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Field type name must not be blank");
            }
        }
        return new FieldTypeRegistry(typesByName);
    }

    private static Map<String, FieldType> defaultNames() {
        Map<String, FieldType> names = new LinkedHashMap<>();
        for (FieldType type : FieldType.values()) {
            names.put(type.getSchemaName(), type);
        }
        return names;
    }

    /**
     * Resolve a schema type name.
     *
     * @param name the type name from a field definition
     * @return the field type, or empty if the name is not registered
     */
    public Optional<FieldType> typeOf(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(typesByName.get(name));
    }

    /**
     * Get the name a field type is registered under.
     *
     * @return the first registered name for the type, or null if not registered
     */
    public String nameOf(FieldType type) {
        return namesByType.get(type);
    }

    /**
     * Get all registered type names in registration order.
     */
    public List<String> getTypeNames() {
        return List.copyOf(typesByName.keySet());
    }

    /**
     * Get the full name table.
     */
    public Map<String, FieldType> asMap() {
        return typesByName;
    }

    @Override
    public String toString() {
        return "FieldTypeRegistry" + typesByName.keySet();
    }
}
