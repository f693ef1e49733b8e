package com.msgpattern.decoder.metrics;

import com.msgpattern.decoder.DecodeListener;
import com.msgpattern.decoder.DecodedMessage;
import com.msgpattern.decoder.SkipReason;
import com.msgpattern.decoder.field.FieldDecodeException;
import com.msgpattern.decoder.schema.CatalogBuildListener;
import com.msgpattern.decoder.schema.FieldDef;
import com.msgpattern.decoder.schema.MessagePattern;
import com.msgpattern.decoder.schema.SchemaParseException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registers schema catalog and message decoding counters.
 *
 * <p>Pass the binder as the listener of both the catalog builder and the
 * decoder. Events arriving before {@link #bindTo(MeterRegistry)} are dropped.</p>
 */
public class DecoderMetricsBinder implements MeterBinder, CatalogBuildListener, DecodeListener {

    private static final Logger log = LoggerFactory.getLogger(DecoderMetricsBinder.class);

    public static final String DEFINITIONS = "msgpattern.schema.definitions";
    public static final String LINES = "msgpattern.decoder.lines";
    public static final String MESSAGES = "msgpattern.decoder.messages";
    public static final String FIELD_FAILURES = "msgpattern.decoder.field.failures";

    private static final String NONE = "none";

    private volatile MeterRegistry registry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        log.info("Registered decoder metrics");
    }

    @Override
    public void onPatternAccepted(MessagePattern pattern) {
        increment(DEFINITIONS, "Schema definition lines by outcome", "outcome", "accepted", "reason", NONE);
    }

    @Override
    public void onDefinitionRejected(SchemaParseException error) {
        increment(DEFINITIONS, "Schema definition lines by outcome",
                "outcome", "rejected", "reason", error.getReason().name());
    }

    @Override
    public void onDuplicateDiscarded(MessagePattern discarded, MessagePattern kept) {
        increment(DEFINITIONS, "Schema definition lines by outcome",
                "outcome", "duplicate", "reason", "DUPLICATE_MESSAGE_ID");
    }

    @Override
    public void onDecoded(DecodedMessage message) {
        increment(LINES, "Message lines by outcome", "outcome", "decoded", "reason", NONE);
        increment(MESSAGES, "Decoded messages by type",
                "message_id", String.valueOf(message.getMessageId()), "message_name", message.getMessageName());
    }

    @Override
    public void onSkipped(int lineNumber, SkipReason reason, String detail) {
        increment(LINES, "Message lines by outcome", "outcome", "skipped", "reason", reason.name());
    }

    @Override
    public void onFieldFailure(MessagePattern pattern, FieldDef field, FieldDecodeException error) {
        increment(FIELD_FAILURES, "Fields that failed to decode", "reason", error.getReason().name());
    }

    private void increment(String name, String description, String... tags) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        String key = name + String.join("|", tags);
        counters.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .tags(tags)
                        .description(description)
                        .register(current)
        ).increment();
    }
}
