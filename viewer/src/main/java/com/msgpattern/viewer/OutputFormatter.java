package com.msgpattern.viewer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.msgpattern.decoder.DecodeSummary;
import com.msgpattern.decoder.DecodedMessage;
import com.msgpattern.decoder.SkipReason;
import com.msgpattern.decoder.field.DecodedField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.math.BigInteger;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Formats decoded messages for output.
 */
public abstract class OutputFormatter {

    private static final Logger log = LoggerFactory.getLogger(OutputFormatter.class);

    protected final PrintWriter out;
    protected final FieldRenderer renderer;

    protected OutputFormatter(PrintWriter out, FieldRenderer renderer) {
        this.out = out;
        this.renderer = renderer;
    }

    /**
     * Write the header (if any).
     */
    public abstract void writeHeader();

    /**
     * Write a single decoded message.
     */
    public abstract void writeMessage(DecodedMessage message);

    /**
     * Write the footer (if any).
     */
    public abstract void writeFooter(DecodeSummary summary);

    // ==================== Factory Methods ====================

    public static OutputFormatter create(OutputFormat format, PrintWriter out, FieldRenderer renderer) {
        return switch (format) {
            case NAMED -> named(out, renderer);
            case JSON -> json(out, renderer);
            default -> text(out, renderer);
        };
    }

    public static OutputFormatter text(PrintWriter out, FieldRenderer renderer) {
        return new TextFormatter(out, renderer);
    }

    public static OutputFormatter named(PrintWriter out, FieldRenderer renderer) {
        return new NamedFormatter(out, renderer);
    }

    public static OutputFormatter json(PrintWriter out, FieldRenderer renderer) {
        return new JsonFormatter(out, renderer);
    }

    // ==================== Text Formatter ====================

    private static class TextFormatter extends OutputFormatter {

        TextFormatter(PrintWriter out, FieldRenderer renderer) {
            super(out, renderer);
        }

        @Override
        public void writeHeader() {
            // values only
        }

        @Override
        public void writeMessage(DecodedMessage message) {
            StringJoiner line = new StringJoiner(",");
            for (DecodedField field : message.getFields()) {
                line.add(renderer.render(field));
            }
            out.println(line);
        }

        @Override
        public void writeFooter(DecodeSummary summary) {
            out.flush();
        }
    }

    // ==================== Named Formatter ====================

    private static class NamedFormatter extends OutputFormatter {

        NamedFormatter(PrintWriter out, FieldRenderer renderer) {
            super(out, renderer);
        }

        @Override
        public void writeHeader() {
        }

        @Override
        public void writeMessage(DecodedMessage message) {
            StringJoiner line = new StringJoiner(",", message.getMessageName() + ": ", "");
            for (DecodedField field : message.getFields()) {
                line.add(field.getName() + "=" + renderer.render(field));
            }
            out.println(line);
        }

        @Override
        public void writeFooter(DecodeSummary summary) {
            out.flush();
        }
    }

    // ==================== JSON Formatter ====================

    private static class JsonFormatter extends OutputFormatter {
        private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        private final ArrayNode messages;

        JsonFormatter(PrintWriter out, FieldRenderer renderer) {
            super(out, renderer);
            this.messages = mapper.createArrayNode();
        }

        @Override
        public void writeHeader() {
            // JSON is written all at once in footer
        }

        @Override
        public void writeMessage(DecodedMessage message) {
            ObjectNode node = messages.addObject();
            node.put("id", message.getMessageId());
            node.put("name", message.getMessageName());
            node.put("line", message.getLineNumber());
            ObjectNode fields = node.putObject("fields");
            for (DecodedField field : message.getFields()) {
                putField(fields, field);
            }
            if (!message.isComplete()) {
                node.put("failedFields", message.getFailedFieldCount());
            }
        }

        private void putField(ObjectNode fields, DecodedField field) {
            String name = field.getName();
            switch (field.getType()) {
                case INTEGER -> fields.put(name, field.getLong());
                case BOOLEAN -> fields.put(name, field.getBoolean());
                case DOUBLE -> {
                    double value = field.getDouble();
                    if (Double.isFinite(value)) {
                        fields.put(name, value);
                    } else {
                        fields.put(name, FieldRenderer.formatDouble(value));
                    }
                }
                case TIMESTAMP -> fields.put(name, new BigInteger(Long.toUnsignedString(field.getTimestamp())));
                default -> fields.put(name, field.getString());
            }
        }

        @Override
        public void writeFooter(DecodeSummary summary) {
            try {
                ObjectNode root = mapper.createObjectNode();
                root.put("linesRead", summary.getLinesRead());
                root.put("decoded", summary.getDecoded());
                root.put("skipped", summary.getSkipped());
                ObjectNode byReason = root.putObject("skippedByReason");
                for (Map.Entry<SkipReason, Long> entry : summary.getSkippedByReason().entrySet()) {
                    byReason.put(entry.getKey().name(), entry.getValue());
                }
                root.set("messages", messages);
                out.println(mapper.writeValueAsString(root));
            } catch (JsonProcessingException e) {
                log.error("Failed to write JSON output", e);
                out.println("{\"error\":\"" + e.getOriginalMessage() + "\"}");
            }
            out.flush();
        }
    }
}
