package com.example.retrieval.retry;

/**
 * Implemented by failures that know whether repeating the call can succeed.
 */
public interface ClassifiedFailure {

    boolean isRetryable();
}
