package com.example.retrieval.retry;

/**
 * Thrown when the calling thread is interrupted during an attempt or the pause after it.
 * The interrupt flag is restored before this is thrown.
 */
public class RetryInterruptedException extends RetryException {

    public RetryInterruptedException(String operation, int attempts, InterruptedException cause) {
        super(operation + " interrupted on attempt " + attempts, operation, attempts, cause);
    }
}
