package com.msgpattern.viewer;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.Locale;

/**
 * Output settings read from the {@code msgpattern.output} block.
 */
public final class ViewerConfig {

    private final OutputFormat format;
    private final String timestampPrefix;

    public ViewerConfig(OutputFormat format, String timestampPrefix) {
        this.format = format;
        this.timestampPrefix = timestampPrefix;
    }

    /**
     * Create output settings from Typesafe Config.
     *
     * @param config the {@code msgpattern} block
     * @throws ConfigException.BadValue if the format is not one of text, named or json
     */
    public static ViewerConfig fromConfig(Config config) {
        String name = config.getString("output.format");
        OutputFormat format;
        try {
            format = OutputFormat.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), "output.format",
                    "expected text, named or json but was '" + name + "'", e);
        }
        return new ViewerConfig(format, config.getString("output.timestamp-prefix"));
    }

    public static ViewerConfig defaults() {
        return new ViewerConfig(OutputFormat.TEXT, FieldRenderer.DEFAULT_TIMESTAMP_PREFIX);
    }

    public OutputFormat getFormat() {
        return format;
    }

    public String getTimestampPrefix() {
        return timestampPrefix;
    }

    public ViewerConfig withFormat(OutputFormat format) {
        return format == null ? this : new ViewerConfig(format, timestampPrefix);
    }

    @Override
    public String toString() {
        return "ViewerConfig{format=" + format + ", timestampPrefix='" + timestampPrefix + "'}";
    }
}
