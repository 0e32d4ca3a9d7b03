package com.example.retrieval.retry;

/**
 * Decides whether a failed attempt should be repeated.
 */
@FunctionalInterface
public interface RetryClassifier {

    /**
     * Retries every failure, whatever its cause.
     */
    RetryClassifier ALWAYS = failure -> true;

    /**
     * Retries everything except failures that declare themselves permanent
     * through {@link ClassifiedFailure}.
     */
    RetryClassifier DEFAULT = failure ->
            !(failure instanceof ClassifiedFailure classified) || classified.isRetryable();

    boolean isRetryable(Throwable failure);
}
