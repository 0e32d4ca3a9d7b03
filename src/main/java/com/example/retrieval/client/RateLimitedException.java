package com.example.retrieval.client;

/**
 * Exception thrown when rate limited (HTTP 429).
 */
public class RateLimitedException extends QueryServiceException {

    private final long retryAfterSeconds;

    public RateLimitedException(long retryAfterSeconds) {
        super(429, "Rate limited. Retry after " + retryAfterSeconds + " seconds", true);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
