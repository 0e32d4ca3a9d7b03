package com.example.retrieval;

import com.example.retrieval.pagination.CancellationSignal;
import com.example.retrieval.retry.RetryConfig;

import java.util.Objects;

/**
 * Per-retrieval settings.
 *
 * @param retry attempts and delay for each page request
 * @param maxPages fail with {@link TooManyPagesException} rather than fetch more pages than this
 * @param cancellation checked before each page request
 */
public record RetrievalOptions(
        RetryConfig retry,
        int maxPages,
        CancellationSignal cancellation
) {
    public static final int DEFAULT_MAX_PAGES = 10_000;

    public RetrievalOptions {
        Objects.requireNonNull(retry, "retry must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be at least 1, got " + maxPages);
        }
    }

    /**
     * Returns the {@link RetryConfig#QUERY} preset, the default page cap and no cancellation.
     */
    public static RetrievalOptions defaults() {
        return of(RetryConfig.defaults());
    }

    /**
     * Creates options with the given retry settings, the default page cap and no cancellation.
     */
    public static RetrievalOptions of(RetryConfig retry) {
        return new RetrievalOptions(retry, DEFAULT_MAX_PAGES, CancellationSignal.NONE);
    }

    /**
     * Returns a copy with different retry settings.
     */
    public RetrievalOptions withRetry(RetryConfig retry) {
        return new RetrievalOptions(retry, maxPages, cancellation);
    }

    /**
     * Returns a copy with a different page cap.
     */
    public RetrievalOptions withMaxPages(int maxPages) {
        return new RetrievalOptions(retry, maxPages, cancellation);
    }

    /**
     * Returns a copy checked against the given cancellation signal.
     */
    public RetrievalOptions withCancellation(CancellationSignal cancellation) {
        return new RetrievalOptions(retry, maxPages, cancellation);
    }
}
