package com.msgpattern.decoder;

import com.msgpattern.decoder.config.DecoderConfig;
import com.msgpattern.decoder.field.DecodedField;
import com.msgpattern.decoder.field.FieldDecodeException;
import com.msgpattern.decoder.field.FieldDecoder;
import com.msgpattern.decoder.field.LenientNumbers;
import com.msgpattern.decoder.schema.FieldDef;
import com.msgpattern.decoder.schema.MessagePattern;
import com.msgpattern.decoder.schema.SchemaCatalog;
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
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Decodes message lines against the patterns of a {@link SchemaCatalog}.
 *
 * <p>A message line has the form {@code <message_id>,<token_1>,...,<token_n>}.
 * The id selects the pattern; each payload token is then decoded as the pattern
 * field at the same position. Problems stay as local as possible:</p>
 * <ul>
 *   <li>a token that fails to decode drops that field only</li>
 *   <li>a line with no payload, an unknown id or too few tokens is skipped
 *       with a {@link SkipReason}</li>
 *   <li>tokens beyond the declared fields are ignored unless
 *       {@code strict-field-count} is set</li>
 * </ul>
 *
 * <p>The decoder keeps no state between lines. The catalog is shared by
 * reference and never modified, so one decoder may serve several threads.</p>
 *
 * <pre>{@code
 * MessageDecoder decoder = new MessageDecoder(catalog, DecoderConfig.defaults());
 * DecodeSummary summary = decoder.decode(Path.of("messages.csv"), message -> render(message));
 * }</pre>
 */
public class MessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(MessageDecoder.class);

    private static final int MIN_TOKENS = 2;

    private final SchemaCatalog catalog;
    private final FieldDecoder fieldDecoder;
    private final String separator;
    private final String commentPrefix;
    private final boolean strictFieldCount;
    private final DecodeListener listener;

    public MessageDecoder(SchemaCatalog catalog, DecoderConfig config, DecodeListener listener) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.fieldDecoder = FieldDecoder.of(config.isLenientNumbers());
        this.separator = config.getMessageSeparator();
        this.commentPrefix = config.getMessageCommentPrefix();
        this.strictFieldCount = config.isStrictFieldCount();
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public MessageDecoder(SchemaCatalog catalog, DecoderConfig config) {
        this(catalog, config, DecodeListener.NOOP);
    }

    public MessageDecoder(SchemaCatalog catalog) {
        this(catalog, DecoderConfig.defaults());
    }

    /**
     * Decode a single message line.
     *
     * <p>The line must not be a comment; batch methods filter those out.</p>
     *
     * @param line the message line
     * @param lineNumber the 1-based line number, used in diagnostics
     * @return the decoded message or the skip reason
     */
    public DecodeResult decodeLine(String line, int lineNumber) {
        List<String> tokens = LineTokenizer.split(line, separator);
        if (tokens.size() < MIN_TOKENS) {
            return skip(lineNumber, SkipReason.TOO_FEW_TOKENS,
                    "found " + tokens.size() + " token(s), need at least " + MIN_TOKENS);
        }

        String idToken = tokens.get(0);
        if (!fieldDecoder.isLenientNumbers() && !LenientNumbers.isInteger(idToken)) {
            return skip(lineNumber, SkipReason.MALFORMED_MESSAGE_ID, "message id '" + idToken + "'");
        }
        long id = LenientNumbers.parseLong(idToken);
        if (id < Integer.MIN_VALUE || id > Integer.MAX_VALUE) {
            return skip(lineNumber, SkipReason.UNKNOWN_MESSAGE_TYPE, "message id " + id + " out of range");
        }

        Optional<MessagePattern> found = catalog.lookup((int) id);
        if (found.isEmpty()) {
            return skip(lineNumber, SkipReason.UNKNOWN_MESSAGE_TYPE, "message id " + id);
        }
        MessagePattern pattern = found.get();

        int payloadCount = tokens.size() - 1;
        if (payloadCount < pattern.getFieldCount()) {
            return skip(lineNumber, SkipReason.FIELD_COUNT_MISMATCH, pattern.getMessageName() + " declares "
                    + pattern.getFieldCount() + " field(s), line carries " + payloadCount);
        }
        if (payloadCount > pattern.getFieldCount()) {
            if (strictFieldCount) {
                return skip(lineNumber, SkipReason.FIELD_COUNT_MISMATCH, pattern.getMessageName() + " declares "
                        + pattern.getFieldCount() + " field(s), line carries " + payloadCount);
            }
            log.debug("Line {}: ignoring {} token(s) beyond the fields of {}",
                    lineNumber, payloadCount - pattern.getFieldCount(), pattern.getMessageName());
        }

        List<DecodedField> fields = new ArrayList<>(pattern.getFieldCount());
        for (int i = 0; i < pattern.getFieldCount(); i++) {
            FieldDef field = pattern.getField(i);
            try {
                fields.add(fieldDecoder.decode(field.getName(), tokens.get(i + 1), field.getType()));
            } catch (FieldDecodeException e) {
                log.warn("Line {}: skipping field {} of {}: {}",
                        lineNumber, field.getName(), pattern.getMessageName(), e.getMessage());
                listener.onFieldFailure(pattern, field, e);
            }
        }

        DecodedMessage message = new DecodedMessage(pattern, fields, lineNumber, line);
        listener.onDecoded(message);
        return DecodeResult.decoded(message);
    }

    /**
     * Decode a batch of message lines, forwarding each decoded message to the sink.
     * Comment and blank lines are passed over.
     *
     * @param lines the message lines
     * @param sink receives decoded messages in line order
     * @return counts for the pass
     */
    public DecodeSummary decodeAll(Iterable<String> lines, Consumer<DecodedMessage> sink) {
        DecodeSummary summary = new DecodeSummary();
        int lineNumber = 0;
        for (String line : lines) {
            process(line, ++lineNumber, summary, sink);
        }
        return finish(summary);
    }

    /**
     * Decode every line from a reader; the reader is not closed.
     *
     * @throws IOException if reading fails
     */
    public DecodeSummary decode(Reader reader, Consumer<DecodedMessage> sink) throws IOException {
        BufferedReader buffered = reader instanceof BufferedReader
                ? (BufferedReader) reader : new BufferedReader(reader);
        DecodeSummary summary = new DecodeSummary();
        int lineNumber = 0;
        String line;
        while ((line = buffered.readLine()) != null) {
            process(line, ++lineNumber, summary, sink);
        }
        return finish(summary);
    }

    /**
     * Decode every line of a UTF-8 message file. Invalid byte sequences
     * decode as U+FFFD instead of failing the pass.
     *
     * @throws IOException if the file cannot be opened or read
     */
    public DecodeSummary decode(Path messageFile, Consumer<DecodedMessage> sink) throws IOException {
        log.info("Decoding messages from {}", messageFile);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(messageFile), StandardCharsets.UTF_8))) {
            return decode(reader, sink);
        }
    }

    private void process(String line, int lineNumber, DecodeSummary summary, Consumer<DecodedMessage> sink) {
        summary.recordLine();
        if (LineTokenizer.isIgnorable(line, commentPrefix)) {
            summary.recordIgnored();
            return;
        }

        DecodeResult result = decodeLine(line, lineNumber);
        summary.record(result);
        if (result.isDecoded()) {
            sink.accept(result.getMessage());
        } else {
            log.warn("Skipping line {} [{}]: {}", lineNumber, result.getSkipReason(), result.getDetail());
        }
    }

    private DecodeSummary finish(DecodeSummary summary) {
        log.info("Decoded {} message(s), skipped {} line(s), {} field failure(s)",
                summary.getDecoded(), summary.getSkipped(), summary.getFieldFailures());
        return summary;
    }

    private DecodeResult skip(int lineNumber, SkipReason reason, String detail) {
        listener.onSkipped(lineNumber, reason, detail);
        return DecodeResult.skipped(reason, detail);
    }

    public SchemaCatalog getCatalog() {
        return catalog;
    }
}
