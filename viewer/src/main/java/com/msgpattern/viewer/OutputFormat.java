package com.msgpattern.viewer;

/**
 * Layout of decoded messages on standard output.
 */
public enum OutputFormat {
    /** Rendered values joined by commas, one message per line. */
    TEXT,
    /** Message name followed by {@code name=value} pairs. */
    NAMED,
    /** A single JSON document written when the pass completes. */
    JSON
}
