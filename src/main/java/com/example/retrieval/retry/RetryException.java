package com.example.retrieval.retry;

/**
 * Base class for failures raised by {@link RetryPolicy}.
 * The cause is always the failure of the last attempt made.
 */
public abstract class RetryException extends RuntimeException {

    private final String operation;
    private final int attempts;

    protected RetryException(String message, String operation, int attempts, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Returns the number of attempts made before giving up.
     */
    public int getAttempts() {
        return attempts;
    }
}
