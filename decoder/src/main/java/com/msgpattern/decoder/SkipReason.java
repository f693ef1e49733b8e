package com.msgpattern.decoder;

/**
 * Why a message line produced no decoded message.
 */
public enum SkipReason {

    TOO_FEW_TOKENS("line has no payload after the message id"),
    MALFORMED_MESSAGE_ID("message id is not an integer"),
    UNKNOWN_MESSAGE_TYPE("no pattern defined for the message id"),
    FIELD_COUNT_MISMATCH("payload token count does not match the pattern");

    private final String description;

    SkipReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
