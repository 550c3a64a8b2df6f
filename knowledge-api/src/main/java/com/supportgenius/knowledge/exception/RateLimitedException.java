package com.supportgenius.knowledge.exception;

/** Raised once the rate-limit backoff budget is spent. */
public class RateLimitedException extends KnowledgeException {

    private final int attempts;

    public RateLimitedException(String operation, int attempts, Throwable cause) {
        super(KnowledgeErrorCode.RATE_LIMITED, operation + " still rate limited after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
