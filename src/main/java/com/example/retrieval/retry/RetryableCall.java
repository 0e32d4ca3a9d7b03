package com.example.retrieval.retry;

/**
 * A single network operation that may be issued more than once.
 * Implementations must be safe to repeat: the same query or the same continuation request.
 *
 * @param <R> the result type
 */
@FunctionalInterface
public interface RetryableCall<R> {

    R call() throws Exception;
}
