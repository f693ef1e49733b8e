package com.msgpattern.decoder.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Configuration for schema parsing and message decoding.
 *
 * <p>Read from the {@code msgpattern} block; defaults live in reference.conf.</p>
 */
public final class DecoderConfig {

    private final String schemaSeparator;
    private final String schemaFieldSeparator;
    private final String schemaCommentPrefix;
    private final String messageSeparator;
    private final String messageCommentPrefix;
    private final boolean lenientNumbers;
    private final boolean strictFieldCount;

    private DecoderConfig(Builder builder) {
        this.schemaSeparator = builder.schemaSeparator;
        this.schemaFieldSeparator = builder.schemaFieldSeparator;
        this.schemaCommentPrefix = builder.schemaCommentPrefix;
        this.messageSeparator = builder.messageSeparator;
        this.messageCommentPrefix = builder.messageCommentPrefix;
        this.lenientNumbers = builder.lenientNumbers;
        this.strictFieldCount = builder.strictFieldCount;
    }

    /**
     * Create configuration from Typesafe Config.
     *
     * @param config the {@code msgpattern} block
     * @throws ConfigException if a path is missing or a separator is empty
     */
    public static DecoderConfig fromConfig(Config config) {
        return builder()
                .schemaSeparator(nonEmpty(config, "schema.separator"))
                .schemaFieldSeparator(nonEmpty(config, "schema.field-separator"))
                .schemaCommentPrefix(nonEmpty(config, "schema.comment-prefix"))
                .messageSeparator(nonEmpty(config, "decoder.separator"))
                .messageCommentPrefix(nonEmpty(config, "decoder.comment-prefix"))
                .lenientNumbers(config.getBoolean("decoder.lenient-numbers"))
                .strictFieldCount(config.getBoolean("decoder.strict-field-count"))
                .build();
    }

    /**
     * Get the built-in defaults without reading any config file.
     */
    public static DecoderConfig defaults() {
        return builder().build();
    }

    private static String nonEmpty(Config config, String path) {
        String value = config.getString(path);
        if (value.isEmpty()) {
            throw new ConfigException.BadValue(config.origin(), path, "must not be empty");
        }
        return value;
    }

    public String getSchemaSeparator() {
        return schemaSeparator;
    }

    public String getSchemaFieldSeparator() {
        return schemaFieldSeparator;
    }

    public String getSchemaCommentPrefix() {
        return schemaCommentPrefix;
    }

    public String getMessageSeparator() {
        return messageSeparator;
    }

    public String getMessageCommentPrefix() {
        return messageCommentPrefix;
    }

    public boolean isLenientNumbers() {
        return lenientNumbers;
    }

    public boolean isStrictFieldCount() {
        return strictFieldCount;
    }

    /**
     * Create a builder seeded with this configuration's values.
     */
    public Builder toBuilder() {
        return builder()
                .schemaSeparator(schemaSeparator)
                .schemaFieldSeparator(schemaFieldSeparator)
                .schemaCommentPrefix(schemaCommentPrefix)
                .messageSeparator(messageSeparator)
                .messageCommentPrefix(messageCommentPrefix)
                .lenientNumbers(lenientNumbers)
                .strictFieldCount(strictFieldCount);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String schemaSeparator = ";";
        private String schemaFieldSeparator = ":";
        private String schemaCommentPrefix = "#";
        private String messageSeparator = ",";
        private String messageCommentPrefix = "#";
        private boolean lenientNumbers = true;
        private boolean strictFieldCount = false;

        private Builder() {}

        public Builder schemaSeparator(String schemaSeparator) {
            this.schemaSeparator = schemaSeparator;
            return this;
        }

        public Builder schemaFieldSeparator(String schemaFieldSeparator) {
            this.schemaFieldSeparator = schemaFieldSeparator;
            return this;
        }

        public Builder schemaCommentPrefix(String schemaCommentPrefix) {
            this.schemaCommentPrefix = schemaCommentPrefix;
            return this;
        }

        public Builder messageSeparator(String messageSeparator) {
            this.messageSeparator = messageSeparator;
            return this;
        }

        public Builder messageCommentPrefix(String messageCommentPrefix) {
            this.messageCommentPrefix = messageCommentPrefix;
            return this;
        }

        public Builder lenientNumbers(boolean lenientNumbers) {
            this.lenientNumbers = lenientNumbers;
            return this;
        }

        public Builder strictFieldCount(boolean strictFieldCount) {
            this.strictFieldCount = strictFieldCount;
            return this;
        }

        public DecoderConfig build() {
            return new DecoderConfig(this);
        }
    }

    @Override
    public String toString() {
        return "DecoderConfig{" +
                "schemaSeparator='" + schemaSeparator + '\'' +
                ", schemaFieldSeparator='" + schemaFieldSeparator + '\'' +
                ", schemaCommentPrefix='" + schemaCommentPrefix + '\'' +
                ", messageSeparator='" + messageSeparator + '\'' +
                ", messageCommentPrefix='" + messageCommentPrefix + '\'' +
                ", lenientNumbers=" + lenientNumbers +
                ", strictFieldCount=" + strictFieldCount +
                '}';
    }
}
