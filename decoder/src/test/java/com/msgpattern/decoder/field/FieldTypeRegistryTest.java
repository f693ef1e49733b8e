package com.msgpattern.decoder.field;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FieldTypeRegistryTest {

    private final FieldTypeRegistry registry = FieldTypeRegistry.standard();

    @Test
    void resolvesStandardNames() {
        assertEquals(Optional.of(FieldType.INTEGER), registry.typeOf("int"));
        assertEquals(Optional.of(FieldType.BOOLEAN), registry.typeOf("bool"));
        assertEquals(Optional.of(FieldType.DOUBLE), registry.typeOf("double"));
        assertEquals(Optional.of(FieldType.STRING), registry.typeOf("string"));
        assertEquals(Optional.of(FieldType.TIMESTAMP), registry.typeOf("ts"));
    }

    @Test
    void unknownNamesAreNotFound() {
        assertTrue(registry.typeOf("float").isEmpty());
        assertTrue(registry.typeOf("INT").isEmpty());
        assertTrue(registry.typeOf("").isEmpty());
        assertTrue(registry.typeOf(null).isEmpty());
    }

    @Test
    void namesInRegistrationOrder() {
        assertEquals(List.of("int", "bool", "double", "string", "ts"), registry.getTypeNames());
        assertEquals("ts", registry.nameOf(FieldType.TIMESTAMP));
    }

    @Test
    void customRegistryIsIndependentOfStandard() {
        FieldTypeRegistry custom = FieldTypeRegistry.of(Map.of("long", FieldType.INTEGER));

        assertEquals(Optional.of(FieldType.INTEGER), custom.typeOf("long"));
        assertTrue(custom.typeOf("int").isEmpty());
        assertTrue(registry.typeOf("long").isEmpty());
        assertNull(custom.nameOf(FieldType.STRING));
    }

    @Test
    void emptyRegistryIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FieldTypeRegistry.of(Map.of()));
        assertThrows(IllegalArgumentException.class, () -> FieldTypeRegistry.of(Map.of(" ", FieldType.STRING)));
    }

    @Test
    void tableIsReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> registry.asMap().put("float", FieldType.DOUBLE));
    }
}
