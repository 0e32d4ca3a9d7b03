package com.example.retrieval;

/**
 * The retrieval was cancelled, by its cancellation signal or by a thread interrupt.
 */
public class RetrievalCancelledException extends RetrievalException {

    public RetrievalCancelledException(int pagesCompleted) {
        super("Retrieval cancelled after " + pagesCompleted + " pages", pagesCompleted);
    }

    public RetrievalCancelledException(int pagesCompleted, Throwable cause) {
        super("Retrieval interrupted after " + pagesCompleted + " pages", pagesCompleted, cause);
    }
}
