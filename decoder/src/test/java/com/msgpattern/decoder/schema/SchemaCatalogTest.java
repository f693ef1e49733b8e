package com.msgpattern.decoder.schema;

import com.msgpattern.decoder.config.DecoderConfig;
import com.msgpattern.decoder.field.FieldType;
import com.msgpattern.decoder.field.FieldTypeRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SchemaCatalogTest {

    @TempDir
    Path tempDir;

    @Test
    void commentLinesAreIgnored() {
        SchemaCatalog catalog = SchemaCatalog.build(List.of(
                "# id;name;fields...",
                "1;Login;user:string;ok:bool"));

        assertEquals(1, catalog.size());
        assertTrue(catalog.lookup(1).isPresent());
        assertEquals("Login", catalog.lookup(1).get().getMessageName());
    }

    @Test
    void blankLinesAreIgnored() {
        SchemaCatalog catalog = SchemaCatalog.build(List.of("", "   ", "1;Login;user:string"));

        assertEquals(1, catalog.size());
    }

    @Test
    void badLinesAreSkippedAndBuildContinues() {
        SchemaCatalog catalog = SchemaCatalog.build(List.of(
                "1;Login;user:string",
                "2;Broken",
                "3;Quote;px:float",
                "4;Logout;user:string"));

        assertEquals(2, catalog.size());
        assertTrue(catalog.contains(1));
        assertFalse(catalog.contains(2));
        assertFalse(catalog.contains(3));
        assertTrue(catalog.contains(4));
    }

    @Test
    void firstDefinitionOfIdWins() {
        SchemaCatalog catalog = SchemaCatalog.build(List.of(
                "5;Trade;qty:int;px:double",
                "5;TradeV2;qty:int;px:double;venue:string"));

        MessagePattern pattern = catalog.lookup(5).orElseThrow();
        assertEquals("Trade", pattern.getMessageName());
        assertEquals(List.of(new FieldDef("qty", FieldType.INTEGER), new FieldDef("px", FieldType.DOUBLE)),
                pattern.getFields());
        assertEquals(1, pattern.getLineNumber());
    }

    @Test
    void lookupOfUnknownIdIsEmpty() {
        SchemaCatalog catalog = SchemaCatalog.build(List.of("1;Login;user:string"));

        assertTrue(catalog.lookup(99).isEmpty());
        assertFalse(catalog.contains(99));
    }

    @Test
    void patternsListedInIdOrder() {
        SchemaCatalog catalog = SchemaCatalog.build(List.of(
                "30;C;c:int",
                "-2;Neg;n:int",
                "10;A;a:int"));

        assertArrayEquals(new int[] {-2, 10, 30}, catalog.getMessageIds());
        assertEquals(List.of("Neg", "A", "C"),
                catalog.getPatterns().stream().map(MessagePattern::getMessageName).toList());
    }

    @Test
    void emptySourceGivesEmptyCatalog() {
        SchemaCatalog catalog = SchemaCatalog.build(List.of("# nothing here", "1;OnlyName"));

        assertTrue(catalog.isEmpty());
        assertEquals(0, catalog.getMessageIds().length);
    }

    @Test
    void listenerSeesEveryOutcome() {
        List<String> events = new ArrayList<>();
        CatalogBuildListener listener = new CatalogBuildListener() {
            @Override
            public void onPatternAccepted(MessagePattern pattern) {
                events.add("accepted:" + pattern.getMessageId());
            }

            @Override
            public void onDefinitionRejected(SchemaParseException error) {
                events.add("rejected:" + error.getReason() + "@" + error.getLineNumber());
            }

            @Override
            public void onDuplicateDiscarded(MessagePattern discarded, MessagePattern kept) {
                events.add("duplicate:" + discarded.getLineNumber() + "->" + kept.getLineNumber());
            }
        };

        SchemaCatalog.builder().listener(listener).build(List.of(
                "1;Login;user:string",
                "# comment",
                "2;Bad;x:nope",
                "1;Again;user:string"));

        assertEquals(List.of("accepted:1", "rejected:UNKNOWN_FIELD_TYPE@3", "duplicate:4->1"), events);
    }

    @Test
    void loadFromFile() throws IOException {
        Path schema = tempDir.resolve("messages.def");
        Files.writeString(schema, """
                # buoy messages
                1;Login;user:string;ok:bool
                2;Reading;temp:double;at:ts
                """);

        SchemaCatalog catalog = SchemaCatalog.load(schema);

        assertEquals(2, catalog.size());
        MessagePattern reading = catalog.lookup(2).orElseThrow();
        assertEquals(3, reading.getLineNumber());
        assertEquals(FieldType.TIMESTAMP, reading.getField(1).getType());
    }

    @Test
    void loadFileWithInvalidUtf8KeepsEveryLine() throws IOException {
        Path schema = tempDir.resolve("latin1.def");
        Files.write(schema, "1;Caf\u00e9;user:string\n2;Reading;temp:double\n".getBytes(StandardCharsets.ISO_8859_1));

        SchemaCatalog catalog = SchemaCatalog.load(schema);

        assertEquals(2, catalog.size());
        assertEquals("Caf\uFFFD", catalog.lookup(1).orElseThrow().getMessageName());
    }

    @Test
    void idWithTrailingTextResolvesLikeMessageIds() {
        SchemaCatalog lenient = SchemaCatalog.build(List.of("1abc;Login;user:string"));
        assertTrue(lenient.contains(1));

        SchemaCatalog strict = SchemaCatalog.builder()
                .config(DecoderConfig.builder().lenientNumbers(false).build(), FieldTypeRegistry.standard())
                .build(List.of("1abc;Login;user:string", "2;Tick;n:int"));
        assertArrayEquals(new int[]{2}, strict.getMessageIds());
    }

    @Test
    void loadFromMissingFileFails() {
        assertThrows(NoSuchFileException.class, () -> SchemaCatalog.load(tempDir.resolve("missing.def")));
    }

    @Test
    void configuredSeparatorsAndCommentPrefix() {
        DecoderConfig config = DecoderConfig.builder()
                .schemaSeparator("|")
                .schemaFieldSeparator("/")
                .schemaCommentPrefix("//")
                .build();

        SchemaCatalog catalog = SchemaCatalog.builder()
                .config(config, FieldTypeRegistry.standard())
                .build(List.of("// header", "8|Ping|seq/int"));

        assertEquals(new FieldDef("seq", FieldType.INTEGER), catalog.lookup(8).orElseThrow().getField(0));
    }

    @Test
    void concurrentLookupsSeeSamePatterns() throws Exception {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            lines.add(i + ";Msg" + i + ";v:int");
        }
        SchemaCatalog catalog = SchemaCatalog.build(lines);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                results.add(executor.submit(() -> {
                    int found = 0;
                    for (int i = 0; i < 200; i++) {
                        if (catalog.lookup(i).map(p -> p.getMessageName().equals("Msg" + p.getMessageId())).orElse(false)) {
                            found++;
                        }
                    }
                    return found;
                }));
            }
            for (Future<Integer> result : results) {
                assertEquals(200, result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
