package com.example.retrieval.retry;

/**
 * Thrown when every allowed attempt failed.
 */
public class RetryExhaustedException extends RetryException {

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(operation + " failed after " + attempts + " attempts. Last error: " + lastFailure.getMessage(),
                operation, attempts, lastFailure);
    }
}
