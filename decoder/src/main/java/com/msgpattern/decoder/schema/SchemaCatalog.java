package com.msgpattern.decoder.schema;

import com.msgpattern.decoder.LineTokenizer;
import com.msgpattern.decoder.config.DecoderConfig;
import com.msgpattern.decoder.field.FieldTypeRegistry;
import org.agrona.collections.Int2ObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable set of {@link MessagePattern}s keyed by message id.
 *
 * <p>A catalog is built once from schema definition lines and is read-only
 * afterwards, so lookups may run from any number of threads without locking.
 * Building is partial-success:</p>
 * <ul>
 *   <li>blank lines and comment lines (default prefix {@code #}) are skipped</li>
 *   <li>a line that fails to parse is logged and skipped</li>
 *   <li>the first definition of an id wins; later ones are logged and discarded</li>
 * </ul>
 *
 * <pre>{@code
 * SchemaCatalog catalog = SchemaCatalog.builder()
 *     .parser(new SchemaParser(registry, ";", ":"))
 *     .load(Path.of("messages.def"));
 *
 * catalog.lookup(1).ifPresent(pattern -> ...);
 * }</pre>
 */
public final class SchemaCatalog {

    private static final Logger log = LoggerFactory.getLogger(SchemaCatalog.class);

    private final Int2ObjectHashMap<MessagePattern> patterns;
    private final int[] messageIds;

    private SchemaCatalog(Int2ObjectHashMap<MessagePattern> patterns) {
        this.patterns = patterns;
        int[] ids = new int[patterns.size()];
        int i = 0;
        for (MessagePattern pattern : patterns.values()) {
            ids[i++] = pattern.getMessageId();
        }
        Arrays.sort(ids);
        this.messageIds = ids;
    }

    /**
     * Build a catalog from definition lines with the standard type names and
     * default separators.
     */
    public static SchemaCatalog build(Iterable<String> lines) {
        return builder().build(lines);
    }

    /**
     * Load a catalog from a schema file with the standard type names and
     * default separators.
     *
     * @throws IOException if the file cannot be opened or read
     */
    public static SchemaCatalog load(Path schemaFile) throws IOException {
        return builder().load(schemaFile);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Look up the pattern for a message id.
     *
     * @return the pattern, or empty if no definition for the id was accepted
     */
    public Optional<MessagePattern> lookup(int messageId) {
        return Optional.ofNullable(patterns.get(messageId));
    }

    public boolean contains(int messageId) {
        return patterns.containsKey(messageId);
    }

    public int size() {
        return messageIds.length;
    }

    public boolean isEmpty() {
        return messageIds.length == 0;
    }

    /**
     * Get the known message ids in ascending order.
     */
    public int[] getMessageIds() {
        return messageIds.clone();
    }

    /**
     * Get all patterns in ascending id order.
     */
    public List<MessagePattern> getPatterns() {
        List<MessagePattern> result = new ArrayList<>(messageIds.length);
        for (int id : messageIds) {
            result.add(patterns.get(id));
        }
        return result;
    }

    @Override
    public String toString() {
        return "SchemaCatalog{patterns=" + messageIds.length + ", ids=" + Arrays.toString(messageIds) + "}";
    }

    /**
     * Builder collecting definition lines into a catalog.
     */
    public static final class Builder {
        private SchemaParser parser = new SchemaParser();
        private String commentPrefix = "#";
        private CatalogBuildListener listener = CatalogBuildListener.NOOP;

        private Builder() {}

        public Builder parser(SchemaParser parser) {
            this.parser = Objects.requireNonNull(parser, "parser");
            return this;
        }

        public Builder commentPrefix(String commentPrefix) {
            this.commentPrefix = Objects.requireNonNull(commentPrefix, "commentPrefix");
            return this;
        }

        public Builder listener(CatalogBuildListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        /**
         * Take parser separators and the comment prefix from configuration.
         */
        public Builder config(DecoderConfig config, FieldTypeRegistry registry) {
            this.parser = SchemaParser.fromConfig(config, registry);
            this.commentPrefix = config.getSchemaCommentPrefix();
            return this;
        }

        /**
         * Build from definition lines.
         */
        public SchemaCatalog build(Iterable<String> lines) {
            Collector collector = new Collector();
            int lineNumber = 0;
            for (String line : lines) {
                collector.accept(line, ++lineNumber);
            }
            return collector.finish();
        }

        /**
         * Build from a reader; the reader is not closed.
         *
         * @throws IOException if reading fails
         */
        public SchemaCatalog build(Reader reader) throws IOException {
            BufferedReader buffered = reader instanceof BufferedReader
                    ? (BufferedReader) reader : new BufferedReader(reader);
            Collector collector = new Collector();
            int lineNumber = 0;
            String line;
            while ((line = buffered.readLine()) != null) {
                collector.accept(line, ++lineNumber);
            }
            return collector.finish();
        }

        /**
         * Build from a UTF-8 schema file. Invalid byte sequences decode as U+FFFD
         * instead of failing the build.
         *
         * @throws IOException if the file cannot be opened or read
         */
        public SchemaCatalog load(Path schemaFile) throws IOException {
            log.info("Loading message patterns from {}", schemaFile);
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(Files.newInputStream(schemaFile), StandardCharsets.UTF_8))) {
                return build(reader);
            }
        }

        private final class Collector {
            private final Int2ObjectHashMap<MessagePattern> patterns = new Int2ObjectHashMap<>();
            private int rejected;
            private int duplicates;

            void accept(String line, int lineNumber) {
                if (LineTokenizer.isIgnorable(line, commentPrefix)) {
                    return;
                }

                MessagePattern pattern;
                try {
                    pattern = parser.parse(line, lineNumber);
                } catch (SchemaParseException e) {
                    rejected++;
                    log.warn("Rejected message definition [{}]: {}", e.getReason(), e.getMessage());
                    listener.onDefinitionRejected(e);
                    return;
                }

                MessagePattern existing = patterns.get(pattern.getMessageId());
                if (existing != null) {
                    duplicates++;
                    log.warn("Message id {} already defined at line {}, ignoring line {}: {}",
                            pattern.getMessageId(), existing.getLineNumber(), lineNumber, line);
                    listener.onDuplicateDiscarded(pattern, existing);
                    return;
                }

                patterns.put(pattern.getMessageId(), pattern);
                log.debug("Parsed message definition {} ({} fields) at line {}",
                        pattern.getMessageId(), pattern.getFieldCount(), lineNumber);
                listener.onPatternAccepted(pattern);
            }

            SchemaCatalog finish() {
                log.info("Message patterns parsed: {} accepted, {} rejected, {} duplicate",
                        patterns.size(), rejected, duplicates);
                return new SchemaCatalog(patterns);
            }
        }
    }
}
