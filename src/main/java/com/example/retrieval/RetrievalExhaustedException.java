package com.example.retrieval;

/**
 * Every attempt allowed for one page request failed. The cause is the last failure.
 */
public class RetrievalExhaustedException extends RetrievalException {

    private final int attempts;

    public RetrievalExhaustedException(int attempts, int pagesCompleted, Throwable lastFailure) {
        super("Retrieval failed after " + attempts + " attempts with " + pagesCompleted
                + " pages completed. Last error: " + lastFailure.getMessage(), pagesCompleted, lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
