package com.msgpattern.decoder.schema;

import com.msgpattern.decoder.LineTokenizer;
import com.msgpattern.decoder.config.DecoderConfig;
import com.msgpattern.decoder.field.FieldType;
import com.msgpattern.decoder.field.FieldTypeRegistry;
import com.msgpattern.decoder.field.LenientNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parses schema definition lines into {@link MessagePattern}s.
 *
 * <p>A definition line has the form</p>
 * <pre>
 *   &lt;message_id&gt;;&lt;message_name&gt;;&lt;field_name&gt;:&lt;field_type&gt;;...
 * </pre>
 * <p>with at least one field definition. Field names and type names are trimmed; type
 * names are resolved through the {@link FieldTypeRegistry} given at construction.
 * Fields are positional, so a name may repeat. The message id follows the numeric
 * policy of message lines: with lenient numbers {@code 1abc} is id 1. Comment lines
 * are the caller's business and are not recognised here.</p>
 */
public class SchemaParser {

    private static final Logger log = LoggerFactory.getLogger(SchemaParser.class);

    private static final int MIN_SEGMENTS = 3;

    private final FieldTypeRegistry registry;
    private final String separator;
    private final String fieldSeparator;
    private final boolean lenientNumbers;

    public SchemaParser(FieldTypeRegistry registry, String separator, String fieldSeparator,
                        boolean lenientNumbers) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.separator = requireNonEmpty(separator, "separator");
        this.fieldSeparator = requireNonEmpty(fieldSeparator, "fieldSeparator");
        this.lenientNumbers = lenientNumbers;
    }

    public SchemaParser(FieldTypeRegistry registry, String separator, String fieldSeparator) {
        this(registry, separator, fieldSeparator, true);
    }

    /**
     * Create a parser using the standard type names and the default separators.
     */
    public SchemaParser() {
        this(FieldTypeRegistry.standard(), ";", ":");
    }

    public static SchemaParser fromConfig(DecoderConfig config, FieldTypeRegistry registry) {
        return new SchemaParser(registry, config.getSchemaSeparator(), config.getSchemaFieldSeparator(),
                config.isLenientNumbers());
    }

    /**
     * Parse one definition line.
     *
     * @param line the definition line
     * @param lineNumber the 1-based line number, used in diagnostics
     * @return the parsed pattern
     * @throws SchemaParseException with {@link SchemaParseException.Reason#MALFORMED_DEFINITION}
     *         for fewer than three segments, an id outside the int range (or not an
     *         integer, with strict numbers), or a field definition without name or type; with
     *         {@link SchemaParseException.Reason#UNKNOWN_FIELD_TYPE} if any field type is
     *         not registered
     */
    public MessagePattern parse(String line, int lineNumber) {
        List<String> segments = LineTokenizer.split(line, separator);
        if (segments.size() < MIN_SEGMENTS) {
            throw malformed(line, lineNumber, "expected id, name and at least one field, found "
                    + segments.size() + " segment(s)");
        }

        int messageId = parseMessageId(segments.get(0), line, lineNumber);
        String messageName = segments.get(1).strip();

        List<FieldDef> fields = new ArrayList<>(segments.size() - 2);
        for (int i = 2; i < segments.size(); i++) {
            FieldDef field = parseFieldDef(segments.get(i), line, lineNumber);
            log.debug("Message {} field {}: {}", messageId, fields.size(), field);
            fields.add(field);
        }

        return new MessagePattern(messageId, messageName, fields, line, lineNumber);
    }

    private int parseMessageId(String segment, String line, int lineNumber) {
        if (!lenientNumbers && !LenientNumbers.isInteger(segment)) {
            throw malformed(line, lineNumber, "message id '" + segment.strip() + "' is not an integer");
        }
        long id = LenientNumbers.parseLong(segment);
        if (id < Integer.MIN_VALUE || id > Integer.MAX_VALUE) {
            throw malformed(line, lineNumber, "message id " + id + " out of range");
        }
        return (int) id;
    }

    private FieldDef parseFieldDef(String fieldDef, String line, int lineNumber) {
        int split = fieldDef.indexOf(fieldSeparator);
        if (split < 0) {
            throw malformed(line, lineNumber, "field definition '" + fieldDef + "' has no type");
        }

        String name = fieldDef.substring(0, split).strip();
        String typeName = fieldDef.substring(split + fieldSeparator.length()).strip();
        if (name.isEmpty()) {
            throw malformed(line, lineNumber, "field definition '" + fieldDef + "' has no name");
        }

        Optional<FieldType> type = registry.typeOf(typeName);
        if (type.isEmpty()) {
            throw new SchemaParseException(SchemaParseException.Reason.UNKNOWN_FIELD_TYPE, line, lineNumber,
                    "field '" + name + "' has unknown type '" + typeName + "'");
        }
        return new FieldDef(name, type.get());
    }

    private static SchemaParseException malformed(String line, int lineNumber, String message) {
        return new SchemaParseException(SchemaParseException.Reason.MALFORMED_DEFINITION, line, lineNumber, message);
    }

    private static String requireNonEmpty(String value, String what) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
        return value;
    }

    public FieldTypeRegistry getRegistry() {
        return registry;
    }

    public boolean isLenientNumbers() {
        return lenientNumbers;
    }
}
