package com.msgpattern.decoder.schema;

import java.util.List;
import java.util.Objects;

/**
 * Declared layout of one message type: its id, a descriptive name and the
 * ordered fields its payload tokens decode into.
 *
 * <p>Field order is significant; the n-th payload token of a message line is
 * decoded as the n-th field. Patterns are immutable.</p>
 */
public final class MessagePattern {

    private final int messageId;
    private final String messageName;
    private final List<FieldDef> fields;
    private final String definition;
    private final int lineNumber;

    /**
     * Create a pattern.
     *
     * @param messageId the message type id
     * @param messageName descriptive name, informational only
     * @param fields the declared fields in decoding order
     * @param definition the schema line the pattern was parsed from, or null
     * @param lineNumber the 1-based line number of the definition, or 0 if unknown
     * @throws IllegalArgumentException if no fields are declared
     */
    public MessagePattern(int messageId, String messageName, List<FieldDef> fields,
                          String definition, int lineNumber) {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Message pattern " + messageId + " declares no fields");
        }
        this.messageId = messageId;
        this.messageName = Objects.requireNonNull(messageName, "messageName");
        this.fields = List.copyOf(fields);
        this.definition = definition;
        this.lineNumber = lineNumber;
    }

    public MessagePattern(int messageId, String messageName, List<FieldDef> fields) {
        this(messageId, messageName, fields, null, 0);
    }

    public int getMessageId() {
        return messageId;
    }

    public String getMessageName() {
        return messageName;
    }

    public List<FieldDef> getFields() {
        return fields;
    }

    public int getFieldCount() {
        return fields.size();
    }

    public FieldDef getField(int index) {
        return fields.get(index);
    }

    /**
     * Get the schema line this pattern was parsed from.
     *
     * @return the definition line, or null if built programmatically
     */
    public String getDefinition() {
        return definition;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public String toString() {
        return "MessagePattern{" + messageId + "=" + messageName + ", fields=" + fields + "}";
    }
}
