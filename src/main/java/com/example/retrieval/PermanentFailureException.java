package com.example.retrieval;

/**
 * A page request failed with an error that repeating the call cannot fix,
 * such as a rejected query.
 */
public class PermanentFailureException extends RetrievalException {

    private final int attempts;

    public PermanentFailureException(int attempts, int pagesCompleted, Throwable failure) {
        super("Retrieval failed permanently on attempt " + attempts + " with " + pagesCompleted
                + " pages completed: " + failure.getMessage(), pagesCompleted, failure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
