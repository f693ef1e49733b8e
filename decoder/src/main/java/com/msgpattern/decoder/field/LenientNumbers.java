package com.msgpattern.decoder.field;

/**
 * Prefix-based numeric parsing that never throws.
 *
 * <p>Each parser skips leading whitespace, accepts an optional sign and then
 * consumes the longest valid numeric prefix. Anything after the prefix is
 * ignored; a token without a valid prefix parses as zero:</p>
 * <pre>
 *   parseLong("42")       = 42
 *   parseLong("  -7kg")   = -7
 *   parseLong("abc")      = 0
 *   parseDouble("3.5e2x") = 350.0
 * </pre>
 *
 * <p>Integer overflow saturates at the bounds of the target range. The
 * {@code is*} methods report whether a whole token is a valid number, which is
 * what strict decoding checks before parsing.</p>
 */
public final class LenientNumbers {

    private static final long UNSIGNED_MULTMAX = 0x1999999999999999L; // (2^64 - 1) / 10
    private static final int UNSIGNED_LAST_DIGIT_MAX = 5;

    private LenientNumbers() {
    }

    /**
     * Parse a signed base-10 integer prefix.
     *
     * @param s the token
     * @return the parsed value, 0 if there is no digit prefix, or
     *         Long.MIN_VALUE / Long.MAX_VALUE on overflow
     */
    public static long parseLong(CharSequence s) {
        int len = s.length();
        int i = skipWhitespace(s, 0);
        boolean negative = false;
        if (i < len && (s.charAt(i) == '-' || s.charAt(i) == '+')) {
            negative = s.charAt(i) == '-';
            i++;
        }

        // Accumulate negatively so Long.MIN_VALUE is reachable
        long limit = negative ? Long.MIN_VALUE : -Long.MAX_VALUE;
        long multmin = limit / 10;
        long result = 0;
        boolean overflow = false;
        while (i < len && isDigit(s.charAt(i))) {
            int digit = s.charAt(i++) - '0';
            if (overflow) {
                continue;
            }
            if (result < multmin) {
                overflow = true;
                continue;
            }
            result *= 10;
            if (result < limit + digit) {
                overflow = true;
                continue;
            }
            result -= digit;
        }

        if (overflow) {
            return negative ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return negative ? result : -result;
    }

    /**
     * Parse an unsigned base-10 integer prefix into the 64 bits of a long.
     *
     * <p>The result is meant to be read with {@link Long#toUnsignedString(long)}.
     * A leading minus negates the value modulo 2^64; overflow saturates at
     * 2^64 - 1 (all bits set).</p>
     *
     * @param s the token
     * @return the parsed value, 0 if there is no digit prefix
     */
    public static long parseUnsignedLong(CharSequence s) {
        int len = s.length();
        int i = skipWhitespace(s, 0);
        boolean negative = false;
        if (i < len && (s.charAt(i) == '-' || s.charAt(i) == '+')) {
            negative = s.charAt(i) == '-';
            i++;
        }

        long result = 0;
        boolean overflow = false;
        while (i < len && isDigit(s.charAt(i))) {
            int digit = s.charAt(i++) - '0';
            if (overflow) {
                continue;
            }
            if (Long.compareUnsigned(result, UNSIGNED_MULTMAX) > 0
                    || (result == UNSIGNED_MULTMAX && digit > UNSIGNED_LAST_DIGIT_MAX)) {
                overflow = true;
                continue;
            }
            result = result * 10 + digit;
        }

        if (overflow) {
            return -1L;
        }
        return negative ? -result : result;
    }

    /**
     * Parse a floating-point prefix.
     *
     * <p>Accepts decimal digits with an optional fraction and exponent, and the
     * words {@code inf}, {@code infinity} and {@code nan} in any case.
     * Hexadecimal floats are not recognised.</p>
     *
     * @param s the token
     * @return the parsed value, 0.0 if there is no valid prefix
     */
    public static double parseDouble(CharSequence s) {
        int start = skipWhitespace(s, 0);
        int end = decimalPrefixEnd(s, start);
        if (end == start) {
            return 0.0;
        }

        int i = start;
        boolean negative = false;
        if (s.charAt(i) == '-' || s.charAt(i) == '+') {
            negative = s.charAt(i) == '-';
            i++;
        }
        char first = Character.toLowerCase(s.charAt(i));
        if (first == 'i') {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (first == 'n') {
            return Double.NaN;
        }
        return Double.parseDouble(s.subSequence(start, end).toString());
    }

    /**
     * Check if the whole token is a signed base-10 integer (surrounding
     * whitespace allowed).
     */
    public static boolean isInteger(CharSequence s) {
        int start = skipWhitespace(s, 0);
        int end = integerPrefixEnd(s, start);
        return end > start && skipWhitespace(s, end) == s.length();
    }

    /**
     * Check if the whole token is a floating-point number (surrounding
     * whitespace allowed).
     */
    public static boolean isDecimal(CharSequence s) {
        int start = skipWhitespace(s, 0);
        int end = decimalPrefixEnd(s, start);
        return end > start && skipWhitespace(s, end) == s.length();
    }

    /**
     * Find the end of an optionally signed digit run.
     *
     * @return the index just past the prefix, or {@code start} if there are no digits
     */
    static int integerPrefixEnd(CharSequence s, int start) {
        int len = s.length();
        int i = start;
        if (i < len && (s.charAt(i) == '-' || s.charAt(i) == '+')) {
            i++;
        }
        int digitsStart = i;
        while (i < len && isDigit(s.charAt(i))) {
            i++;
        }
        return i > digitsStart ? i : start;
    }

    /**
     * Find the end of the longest floating-point prefix.
     *
     * @return the index just past the prefix, or {@code start} if there is none
     */
    static int decimalPrefixEnd(CharSequence s, int start) {
        int len = s.length();
        int i = start;
        if (i < len && (s.charAt(i) == '-' || s.charAt(i) == '+')) {
            i++;
        }

        int word = matchSpecialWord(s, i);
        if (word > i) {
            return word;
        }

        int digits = 0;
        while (i < len && isDigit(s.charAt(i))) {
            i++;
            digits++;
        }
        if (i < len && s.charAt(i) == '.') {
            int afterPoint = i + 1;
            while (afterPoint < len && isDigit(s.charAt(afterPoint))) {
                afterPoint++;
                digits++;
            }
            i = afterPoint;
        }
        if (digits == 0) {
            return start;
        }

        // Exponent only counts when at least one digit follows it
        if (i < len && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
            int exp = i + 1;
            if (exp < len && (s.charAt(exp) == '-' || s.charAt(exp) == '+')) {
                exp++;
            }
            int expDigitsStart = exp;
            while (exp < len && isDigit(s.charAt(exp))) {
                exp++;
            }
            if (exp > expDigitsStart) {
                i = exp;
            }
        }
        return i;
    }

    private static int matchSpecialWord(CharSequence s, int i) {
        if (regionMatchesIgnoreCase(s, i, "infinity")) {
            return i + 8;
        }
        if (regionMatchesIgnoreCase(s, i, "inf")) {
            return i + 3;
        }
        if (regionMatchesIgnoreCase(s, i, "nan")) {
            return i + 3;
        }
        return i;
    }

    private static boolean regionMatchesIgnoreCase(CharSequence s, int offset, String word) {
        if (offset + word.length() > s.length()) {
            return false;
        }
        for (int k = 0; k < word.length(); k++) {
            if (Character.toLowerCase(s.charAt(offset + k)) != word.charAt(k)) {
                return false;
            }
        }
        return true;
    }

    private static int skipWhitespace(CharSequence s, int i) {
        int len = s.length();
        while (i < len && isSpace(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
