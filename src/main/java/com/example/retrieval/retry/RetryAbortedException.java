package com.example.retrieval.retry;

/**
 * Thrown when a failure is classified as permanent, so no further attempt is made.
 */
public class RetryAbortedException extends RetryException {

    public RetryAbortedException(String operation, int attempts, Throwable failure) {
        super(operation + " failed permanently on attempt " + attempts + ": " + failure.getMessage(),
                operation, attempts, failure);
    }
}
