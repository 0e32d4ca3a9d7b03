package com.example.retrieval;

/**
 * Base class for every failure that terminates a retrieval.
 *
 * <p>A retrieval never returns partial results: records accumulated before the failure are
 * discarded. {@link #getPagesCompleted()} tells how far the retrieval got, for messages.
 */
public abstract class RetrievalException extends RuntimeException {

    private final int pagesCompleted;

    protected RetrievalException(String message, int pagesCompleted) {
        super(message);
        this.pagesCompleted = pagesCompleted;
    }

    protected RetrievalException(String message, int pagesCompleted, Throwable cause) {
        super(message, cause);
        this.pagesCompleted = pagesCompleted;
    }

    /**
     * Returns the number of pages fully received before the failure.
     */
    public int getPagesCompleted() {
        return pagesCompleted;
    }
}
