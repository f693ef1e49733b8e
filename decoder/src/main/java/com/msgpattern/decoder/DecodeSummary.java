package com.msgpattern.decoder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts gathered over one batch pass of a {@link MessageDecoder}.
 *
 * <p>Not thread-safe; a summary belongs to the pass that fills it.</p>
 */
public final class DecodeSummary {

    private long linesRead;
    private long ignoredLines;
    private long decoded;
    private long incomplete;
    private long fieldFailures;
    private final Map<SkipReason, Long> skipped = new EnumMap<>(SkipReason.class);

    void recordLine() {
        linesRead++;
    }

    void recordIgnored() {
        ignoredLines++;
    }

    void record(DecodeResult result) {
        if (result.isDecoded()) {
            decoded++;
            DecodedMessage message = result.getMessage();
            if (!message.isComplete()) {
                incomplete++;
                fieldFailures += message.getFailedFieldCount();
            }
        } else {
            skipped.merge(result.getSkipReason(), 1L, Long::sum);
        }
    }

    /**
     * Get the number of physical lines read, including comments and blank lines.
     */
    public long getLinesRead() {
        return linesRead;
    }

    /**
     * Get the number of comment and blank lines passed over.
     */
    public long getIgnoredLines() {
        return ignoredLines;
    }

    public long getDecoded() {
        return decoded;
    }

    /**
     * Get the number of decoded messages with at least one failed field.
     */
    public long getIncomplete() {
        return incomplete;
    }

    public long getFieldFailures() {
        return fieldFailures;
    }

    public long getSkipped() {
        long total = 0;
        for (long count : skipped.values()) {
            total += count;
        }
        return total;
    }

    public long getSkipped(SkipReason reason) {
        return skipped.getOrDefault(reason, 0L);
    }

    public Map<SkipReason, Long> getSkippedByReason() {
        return Collections.unmodifiableMap(skipped);
    }

    @Override
    public String toString() {
        return "DecodeSummary{" +
                "linesRead=" + linesRead +
                ", ignored=" + ignoredLines +
                ", decoded=" + decoded +
                ", incomplete=" + incomplete +
                ", fieldFailures=" + fieldFailures +
                ", skipped=" + skipped +
                '}';
    }
}
