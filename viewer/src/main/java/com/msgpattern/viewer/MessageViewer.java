package com.msgpattern.viewer;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.msgpattern.config.ConfigLoader;
import com.msgpattern.decoder.DecodeSummary;
import com.msgpattern.decoder.MessageDecoder;
import com.msgpattern.decoder.SkipReason;
import com.msgpattern.decoder.config.DecoderConfig;
import com.msgpattern.decoder.field.FieldType;
import com.msgpattern.decoder.field.FieldTypeRegistry;
import com.msgpattern.decoder.metrics.DecoderMetricsBinder;
import com.msgpattern.decoder.schema.CatalogBuildListener;
import com.msgpattern.decoder.schema.FieldDef;
import com.msgpattern.decoder.schema.MessagePattern;
import com.msgpattern.decoder.schema.SchemaCatalog;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command-line utility for decoding message files against a schema file.
 *
 * <p>Decoded messages go to standard output, one per line. Rejected schema lines,
 * skipped message lines and field failures are logged to standard error.</p>
 *
 * <h2>Usage Examples</h2>
 * <pre>
 * # Decode messages (same as the decode subcommand)
 * msgdecode schema.txt messages.csv
 *
 * # Print field names, and a summary on stderr
 * msgdecode decode schema.txt messages.csv --format named --summary
 *
 * # Reject numeric tokens that are not numbers as a whole
 * msgdecode decode schema.txt messages.csv --strict-numbers
 *
 * # Use a config file for separators and output settings
 * msgdecode decode schema.txt messages.csv -c buoy.conf
 *
 * # List the message patterns of a schema
 * msgdecode schemas schema.txt --format json
 *
 * # Count outcomes of a decode pass
 * msgdecode stats schema.txt messages.csv
 *
 * # List the field types usable in a schema
 * msgdecode types
 * </pre>
 */
@Command(name = "msgdecode",
        mixinStandardHelpOptions = true,
        version = "msgdecode 1.0",
        description = "Decode delimited message lines using message patterns from a schema file.",
        subcommands = {
                MessageViewer.DecodeCommand.class,
                MessageViewer.SchemasCommand.class,
                MessageViewer.StatsCommand.class,
                MessageViewer.TypesCommand.class,
                CommandLine.HelpCommand.class
        })
public class MessageViewer implements Callable<Integer> {

    static final String LOGGER_ROOT = "com.msgpattern";

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<schema-file>",
            description = "Schema file with one message definition per line")
    Path schemaFile;

    @Parameters(index = "1", arity = "0..1", paramLabel = "<message-file>",
            description = "Message file with one message per line")
    Path messageFile;

    @CommandLine.Mixin
    DecodeOptions options = new DecodeOptions();

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new MessageViewer())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        if (schemaFile == null) {
            // No subcommand or files, show help
            spec.commandLine().usage(spec.commandLine().getOut());
            return 0;
        }
        if (messageFile == null) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Missing required parameter: '<message-file>'");
        }
        return runDecode(spec, options, schemaFile, messageFile);
    }

    // ==================== Shared Steps ====================

    static int runDecode(CommandSpec spec, DecodeOptions options, Path schemaFile, Path messageFile) {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        options.applyLogLevel();

        Settings settings = Settings.load(options, err);
        if (settings == null) {
            return 1;
        }

        SchemaCatalog catalog = loadCatalog(schemaFile, settings.decoderConfig, CatalogBuildListener.NOOP, err);
        if (catalog == null) {
            return 1;
        }

        ViewerConfig viewerConfig = settings.viewerConfig.withFormat(options.format);
        OutputFormatter formatter = OutputFormatter.create(viewerConfig.getFormat(), out,
                new FieldRenderer(viewerConfig.getTimestampPrefix()));
        MessageDecoder decoder = new MessageDecoder(catalog, settings.decoderConfig);

        formatter.writeHeader();
        DecodeSummary summary;
        try {
            summary = decoder.decode(messageFile, formatter::writeMessage);
        } catch (IOException e) {
            out.flush();
            err.println("Error: Cannot read message file " + messageFile + ": " + describe(e));
            return 1;
        }
        formatter.writeFooter(summary);

        if (options.summary) {
            printSummary(summary, err);
        }
        return 0;
    }

    /**
     * Build the catalog, reporting problems on the error writer.
     *
     * @return the catalog, or null if the file cannot be read or yields no pattern
     */
    static SchemaCatalog loadCatalog(Path schemaFile, DecoderConfig config, CatalogBuildListener listener,
                                     PrintWriter err) {
        SchemaCatalog catalog;
        try {
            catalog = SchemaCatalog.builder()
                    .config(config, FieldTypeRegistry.standard())
                    .listener(listener)
                    .load(schemaFile);
        } catch (IOException e) {
            err.println("Error: Cannot read schema file " + schemaFile + ": " + describe(e));
            return null;
        }
        if (catalog.isEmpty()) {
            err.println("Error: No valid message definition in " + schemaFile);
            return null;
        }
        return catalog;
    }

    static void printSummary(DecodeSummary summary, PrintWriter err) {
        err.printf("Lines read:     %d%n", summary.getLinesRead());
        err.printf("Ignored lines:  %d%n", summary.getIgnoredLines());
        err.printf("Decoded:        %d%n", summary.getDecoded());
        err.printf("Incomplete:     %d (%d field failures)%n", summary.getIncomplete(), summary.getFieldFailures());
        err.printf("Skipped:        %d%n", summary.getSkipped());
        for (Map.Entry<SkipReason, Long> entry : summary.getSkippedByReason().entrySet()) {
            err.printf("  %-22s %d%n", entry.getKey(), entry.getValue());
        }
        err.flush();
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() + " (" + e.getClass().getSimpleName() + ")"
                : e.getClass().getSimpleName();
    }

    /**
     * Decoder and output settings resolved from config files and command-line flags.
     */
    static final class Settings {
        final DecoderConfig decoderConfig;
        final ViewerConfig viewerConfig;

        private Settings(DecoderConfig decoderConfig, ViewerConfig viewerConfig) {
            this.decoderConfig = decoderConfig;
            this.viewerConfig = viewerConfig;
        }

        static Settings load(CommonOptions options, PrintWriter err) {
            try {
                Config config = ConfigLoader.load(options.configFiles).getConfig("msgpattern");
                DecoderConfig.Builder decoder = DecoderConfig.fromConfig(config).toBuilder();
                if (options.strictFieldCount) {
                    decoder.strictFieldCount(true);
                }
                if (options.strictNumbers) {
                    decoder.lenientNumbers(false);
                }
                return new Settings(decoder.build(), ViewerConfig.fromConfig(config));
            } catch (ConfigLoader.ConfigurationException | ConfigException e) {
                err.println("Error: Invalid configuration: " + e.getMessage());
                return null;
            }
        }
    }

    // ==================== Common Options Mixin ====================

    static class CommonOptions {
        @Option(names = {"-c", "--config"}, paramLabel = "<file>",
                description = "Config file, may be repeated; later files override earlier ones")
        List<String> configFiles = new ArrayList<>();

        @Option(names = {"--strict-field-count"},
                description = "Skip message lines with more tokens than the pattern declares")
        boolean strictFieldCount;

        @Option(names = {"--strict-numbers"},
                description = "Reject numeric tokens that are not valid numbers as a whole")
        boolean strictNumbers;

        @Option(names = {"--log-level"}, paramLabel = "<level>",
                description = "Log level for diagnostics on stderr: TRACE, DEBUG, INFO, WARN, ERROR")
        String logLevel;

        void applyLogLevel() {
            if (logLevel != null && !logLevel.isEmpty()) {
                ch.qos.logback.classic.Logger logger =
                        (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(LOGGER_ROOT);
                logger.setLevel(Level.toLevel(logLevel, Level.INFO));
            }
        }
    }

    static class DecodeOptions extends CommonOptions {
        @Option(names = {"-f", "--format"}, paramLabel = "<format>",
                description = "Output format: text, named, json (default: from config, text)")
        OutputFormat format;

        @Option(names = {"--summary"}, description = "Print decode counts to stderr when done")
        boolean summary;
    }

    // ==================== Decode Command ====================

    @Command(name = "decode",
            description = "Decode a message file and print one line per decoded message.",
            mixinStandardHelpOptions = true)
    static class DecodeCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "<schema-file>", description = "Schema file")
        Path schemaFile;

        @Parameters(index = "1", paramLabel = "<message-file>", description = "Message file")
        Path messageFile;

        @CommandLine.Mixin
        DecodeOptions options = new DecodeOptions();

        @Override
        public Integer call() {
            return runDecode(spec, options, schemaFile, messageFile);
        }
    }

    // ==================== Schemas Command ====================

    @Command(name = "schemas",
            description = "List the message patterns built from a schema file.",
            mixinStandardHelpOptions = true)
    static class SchemasCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "<schema-file>", description = "Schema file")
        Path schemaFile;

        @CommandLine.Mixin
        CommonOptions options = new CommonOptions();

        @Option(names = {"-f", "--format"}, description = "Output format: text, json (default: text)")
        String format = "text";

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            options.applyLogLevel();

            Settings settings = Settings.load(options, err);
            if (settings == null) {
                return 1;
            }
            SchemaCatalog catalog = loadCatalog(schemaFile, settings.decoderConfig, CatalogBuildListener.NOOP, err);
            if (catalog == null) {
                return 1;
            }

            if ("json".equalsIgnoreCase(format)) {
                printJson(catalog, out);
            } else {
                printText(catalog, out);
            }
            out.flush();
            return 0;
        }

        private void printText(SchemaCatalog catalog, PrintWriter out) {
            out.printf("%-10s %-24s %s%n", "Id", "Name", "Fields");
            out.println("-".repeat(70));
            for (MessagePattern pattern : catalog.getPatterns()) {
                StringJoiner fields = new StringJoiner(", ");
                for (FieldDef field : pattern.getFields()) {
                    fields.add(field.toString());
                }
                out.printf("%-10d %-24s %s%n", pattern.getMessageId(), pattern.getMessageName(), fields);
            }
            out.println();
            out.printf("Total: %d message patterns%n", catalog.size());
        }

        private void printJson(SchemaCatalog catalog, PrintWriter out) throws Exception {
            ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            ArrayNode patterns = mapper.createArrayNode();
            for (MessagePattern pattern : catalog.getPatterns()) {
                ObjectNode node = patterns.addObject();
                node.put("id", pattern.getMessageId());
                node.put("name", pattern.getMessageName());
                node.put("line", pattern.getLineNumber());
                ArrayNode fields = node.putArray("fields");
                for (FieldDef field : pattern.getFields()) {
                    fields.addObject()
                            .put("name", field.getName())
                            .put("type", field.getType().getSchemaName());
                }
            }
            ObjectNode root = mapper.createObjectNode();
            root.put("schemaFile", schemaFile.toString());
            root.put("totalPatterns", catalog.size());
            root.set("patterns", patterns);
            out.println(mapper.writeValueAsString(root));
        }
    }

    // ==================== Stats Command ====================

    @Command(name = "stats",
            description = "Decode a message file and show counts per outcome and message type.",
            mixinStandardHelpOptions = true)
    static class StatsCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "<schema-file>", description = "Schema file")
        Path schemaFile;

        @Parameters(index = "1", paramLabel = "<message-file>", description = "Message file")
        Path messageFile;

        @CommandLine.Mixin
        CommonOptions options = new CommonOptions();

        @Option(names = {"-f", "--format"}, description = "Output format: text, json (default: text)")
        String format = "text";

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            options.applyLogLevel();

            Settings settings = Settings.load(options, err);
            if (settings == null) {
                return 1;
            }

            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            DecoderMetricsBinder metrics = new DecoderMetricsBinder();
            metrics.bindTo(registry);

            SchemaCatalog catalog = loadCatalog(schemaFile, settings.decoderConfig, metrics, err);
            if (catalog == null) {
                return 1;
            }

            MessageDecoder decoder = new MessageDecoder(catalog, settings.decoderConfig, metrics);
            DecodeSummary summary;
            try {
                summary = decoder.decode(messageFile, message -> { });
            } catch (IOException e) {
                err.println("Error: Cannot read message file " + messageFile + ": " + describe(e));
                return 1;
            }

            List<Counter> counters = registry.getMeters().stream()
                    .filter(meter -> meter instanceof Counter)
                    .map(meter -> (Counter) meter)
                    .sorted(Comparator.comparing(StatsCommand::sortKey))
                    .collect(Collectors.toList());

            if ("json".equalsIgnoreCase(format)) {
                printJson(counters, summary, out);
            } else {
                printText(counters, summary, out);
            }
            out.flush();
            return 0;
        }

        private static String sortKey(Meter meter) {
            return meter.getId().getName() + formatTags(meter.getId().getTags());
        }

        private static String formatTags(List<Tag> tags) {
            StringJoiner joiner = new StringJoiner(",", "{", "}");
            for (Tag tag : tags) {
                joiner.add(tag.getKey() + "=" + tag.getValue());
            }
            return joiner.toString();
        }

        private void printText(List<Counter> counters, DecodeSummary summary, PrintWriter out) {
            out.println("Decode Statistics");
            out.println("=================");
            out.println();
            out.println("Schema file:  " + schemaFile);
            out.println("Message file: " + messageFile);
            out.printf("Lines read: %d, decoded: %d, skipped: %d%n",
                    summary.getLinesRead(), summary.getDecoded(), summary.getSkipped());
            out.println();
            out.printf("%-36s %-50s %8s%n", "Counter", "Tags", "Count");
            out.println("-".repeat(96));
            for (Counter counter : counters) {
                out.printf("%-36s %-50s %8d%n", counter.getId().getName(),
                        formatTags(counter.getId().getTags()), (long) counter.count());
            }
        }

        private void printJson(List<Counter> counters, DecodeSummary summary, PrintWriter out) throws Exception {
            ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            ObjectNode root = mapper.createObjectNode();
            root.put("schemaFile", schemaFile.toString());
            root.put("messageFile", messageFile.toString());
            root.put("linesRead", summary.getLinesRead());
            root.put("decoded", summary.getDecoded());
            root.put("skipped", summary.getSkipped());
            ArrayNode nodes = root.putArray("counters");
            for (Counter counter : counters) {
                ObjectNode node = nodes.addObject();
                node.put("name", counter.getId().getName());
                ObjectNode tags = node.putObject("tags");
                for (Tag tag : counter.getId().getTags()) {
                    tags.put(tag.getKey(), tag.getValue());
                }
                node.put("count", (long) counter.count());
            }
            out.println(mapper.writeValueAsString(root));
        }
    }

    // ==================== Types Command ====================

    @Command(name = "types",
            description = "List the field types usable in schema definitions.",
            mixinStandardHelpOptions = true)
    static class TypesCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            out.println("Field Types");
            out.println("===========");
            out.println();
            out.printf("%-10s %s%n", "Name", "Type");
            out.println("-".repeat(25));
            for (Map.Entry<String, FieldType> entry : FieldTypeRegistry.standard().asMap().entrySet()) {
                out.printf("%-10s %s%n", entry.getKey(), entry.getValue());
            }
            out.flush();
            return 0;
        }
    }
}
