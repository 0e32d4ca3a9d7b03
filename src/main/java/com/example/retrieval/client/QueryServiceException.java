package com.example.retrieval.client;

import com.example.retrieval.retry.ClassifiedFailure;

import java.io.IOException;

/**
 * Exception thrown when the query service answers with an error status.
 *
 * <p>Timeouts (408), rate limiting (429) and server errors (5xx) are retryable; any other
 * client error means the request itself is wrong and repeating it cannot help. A status code
 * of 0 marks a request refused before it was sent.
 */
public class QueryServiceException extends IOException implements ClassifiedFailure {

    private final int statusCode;
    private final boolean retryable;

    public QueryServiceException(int statusCode, String message) {
        this(statusCode, message, isRetryableStatus(statusCode));
    }

    public QueryServiceException(int statusCode, String message, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }

    static boolean isRetryableStatus(int statusCode) {
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }
}
