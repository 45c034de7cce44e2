package com.permit.resolution.cascade;

/**
 * A mention that cannot be resolved. Never escapes the cascade: the mention is
 * counted as skipped and the run continues.
 */
public class MalformedMentionException extends RuntimeException {

    private final String mentionId;
    private final SkipReason reason;

    public MalformedMentionException(String mentionId, SkipReason reason, String message) {
        super(message);
        this.mentionId = mentionId;
        this.reason = reason;
    }

    public String getMentionId() {
        return mentionId;
    }

    public SkipReason getReason() {
        return reason;
    }
}
