package com.msgpattern.decoder.metrics;

import com.msgpattern.decoder.MessageDecoder;
import com.msgpattern.decoder.config.DecoderConfig;
import com.msgpattern.decoder.schema.SchemaCatalog;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecoderMetricsBinderTest {

    private SimpleMeterRegistry registry;
    private DecoderMetricsBinder binder;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        binder = new DecoderMetricsBinder();
        binder.bindTo(registry);
    }

    @Test
    void countsCatalogDefinitions() {
        SchemaCatalog.builder()
                .listener(binder)
                .build(List.of(
                        "1;Login;user:string",
                        "2;Reading;temp:float",
                        "1;Again;user:string",
                        "garbage"));

        assertEquals(1.0, count(DecoderMetricsBinder.DEFINITIONS, "outcome", "accepted"));
        assertEquals(2.0, count(DecoderMetricsBinder.DEFINITIONS, "outcome", "rejected"));
        assertEquals(1.0, count(DecoderMetricsBinder.DEFINITIONS, "outcome", "duplicate"));
        assertEquals(1.0, registry.get(DecoderMetricsBinder.DEFINITIONS)
                .tag("reason", "UNKNOWN_FIELD_TYPE").counter().count());
    }

    @Test
    void countsDecodedAndSkippedLines() {
        SchemaCatalog catalog = SchemaCatalog.build(List.of("1;Login;user:string;ok:bool", "2;Tick;n:int"));
        MessageDecoder decoder = new MessageDecoder(catalog,
                DecoderConfig.builder().lenientNumbers(false).build(), binder);

        decoder.decodeAll(List.of("1,alice,1", "1,bob,0", "2,x", "99,z", "1"), m -> { });

        assertEquals(3.0, count(DecoderMetricsBinder.LINES, "outcome", "decoded"));
        assertEquals(2.0, count(DecoderMetricsBinder.LINES, "outcome", "skipped"));
        assertEquals(2.0, registry.get(DecoderMetricsBinder.MESSAGES).tag("message_name", "Login").counter().count());
        assertEquals(1.0, registry.get(DecoderMetricsBinder.MESSAGES).tag("message_id", "2").counter().count());
        assertEquals(1.0, registry.get(DecoderMetricsBinder.FIELD_FAILURES)
                .tag("reason", "MALFORMED_NUMBER").counter().count());
    }

    @Test
    void eventsBeforeBindingAreDropped() {
        DecoderMetricsBinder unbound = new DecoderMetricsBinder();
        SchemaCatalog.builder().listener(unbound).build(List.of("1;Login;user:string"));

        SimpleMeterRegistry later = new SimpleMeterRegistry();
        unbound.bindTo(later);

        assertTrue(later.find(DecoderMetricsBinder.DEFINITIONS).counters().isEmpty());
    }

    private double count(String name, String tagKey, String tagValue) {
        double total = 0;
        for (Counter counter : registry.get(name).tag(tagKey, tagValue).counters()) {
            total += counter.count();
        }
        return total;
    }
}
