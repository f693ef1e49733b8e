package com.msgpattern.decoder;

import com.msgpattern.decoder.field.DecodedField;
import com.msgpattern.decoder.schema.MessagePattern;

import java.util.List;
import java.util.Objects;

/**
 * Result of decoding one message line against its pattern.
 *
 * <p>Fields appear in pattern order. A field whose token failed to decode is
 * left out, so {@link #getFields()} can be shorter than the pattern; see
 * {@link #isComplete()}.</p>
 */
public final class DecodedMessage {

    private final MessagePattern pattern;
    private final List<DecodedField> fields;
    private final int lineNumber;
    private final String rawLine;

    public DecodedMessage(MessagePattern pattern, List<DecodedField> fields, int lineNumber, String rawLine) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.fields = List.copyOf(fields);
        this.lineNumber = lineNumber;
        this.rawLine = rawLine;
    }

    public MessagePattern getPattern() {
        return pattern;
    }

    public int getMessageId() {
        return pattern.getMessageId();
    }

    public String getMessageName() {
        return pattern.getMessageName();
    }

    public List<DecodedField> getFields() {
        return fields;
    }

    /**
     * Find a decoded field by name.
     *
     * @return the field, or null if the pattern has no such field or it failed to decode
     */
    public DecodedField getField(String name) {
        for (DecodedField field : fields) {
            if (field.getName().equals(name)) {
                return field;
            }
        }
        return null;
    }

    /**
     * Check if every declared field decoded.
     */
    public boolean isComplete() {
        return fields.size() == pattern.getFieldCount();
    }

    /**
     * Get the number of declared fields that failed to decode.
     */
    public int getFailedFieldCount() {
        return pattern.getFieldCount() - fields.size();
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getRawLine() {
        return rawLine;
    }

    @Override
    public String toString() {
        return "DecodedMessage{" + pattern.getMessageId() + "=" + pattern.getMessageName()
                + ", line=" + lineNumber + ", fields=" + fields + "}";
    }
}
