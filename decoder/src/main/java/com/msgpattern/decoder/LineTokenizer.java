package com.msgpattern.decoder;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a line on a literal delimiter.
 *
 * <p>Empty tokens are kept, so {@code "1,,x"} yields three tokens. A field left
 * empty between two delimiters still occupies its position.</p>
 */
public final class LineTokenizer {

    private LineTokenizer() {
    }

    /**
     * Split a line on every occurrence of the delimiter.
     *
     * @param line the line, without its line terminator
     * @param delimiter the literal delimiter, not a regular expression
     * @return the tokens; a line without the delimiter yields one token
     */
    public static List<String> split(String line, String delimiter) {
        if (delimiter.isEmpty()) {
            throw new IllegalArgumentException("Delimiter must not be empty");
        }
        List<String> tokens = new ArrayList<>();
        int start = 0;
        int idx;
        while ((idx = line.indexOf(delimiter, start)) >= 0) {
            tokens.add(line.substring(start, idx));
            start = idx + delimiter.length();
        }
        tokens.add(line.substring(start));
        return tokens;
    }

    /**
     * Check if a line should be passed over: blank, or starting with the comment prefix.
     */
    public static boolean isIgnorable(String line, String commentPrefix) {
        return line.isBlank() || line.startsWith(commentPrefix);
    }
}
