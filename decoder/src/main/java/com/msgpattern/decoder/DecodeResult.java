package com.msgpattern.decoder;

import java.util.Objects;

/**
 * Either a {@link DecodedMessage} or the reason a line was skipped.
 */
public final class DecodeResult {

    private final DecodedMessage message;
    private final SkipReason skipReason;
    private final String detail;

    private DecodeResult(DecodedMessage message, SkipReason skipReason, String detail) {
        this.message = message;
        this.skipReason = skipReason;
        this.detail = detail;
    }

    public static DecodeResult decoded(DecodedMessage message) {
        return new DecodeResult(Objects.requireNonNull(message, "message"), null, null);
    }

    public static DecodeResult skipped(SkipReason reason, String detail) {
        return new DecodeResult(null, Objects.requireNonNull(reason, "reason"), detail);
    }

    public boolean isDecoded() {
        return message != null;
    }

    /**
     * @return the decoded message, or null if the line was skipped
     */
    public DecodedMessage getMessage() {
        return message;
    }

    /**
     * @return the skip reason, or null if the line decoded
     */
    public SkipReason getSkipReason() {
        return skipReason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return isDecoded() ? "Decoded{" + message + "}" : "Skipped{" + skipReason + ": " + detail + "}";
    }
}
