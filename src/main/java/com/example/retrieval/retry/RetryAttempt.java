package com.example.retrieval.retry;

/**
 * Bookkeeping for one failed attempt inside a single {@link RetryPolicy#execute} invocation.
 *
 * @param number 1-based attempt number
 * @param failure the error reported by that attempt
 */
public record RetryAttempt(int number, Throwable failure) {
}
