package com.example.retrieval;

/**
 * A page reported that more data exists but supplied no continuation token.
 * Never retried: the same response shape would come back.
 */
public class MalformedPageException extends RetrievalException {

    private final String reason;

    public MalformedPageException(String reason) {
        this(reason, 0);
    }

    public MalformedPageException(String reason, int pagesCompleted) {
        super("Malformed page after " + pagesCompleted + " pages: " + reason, pagesCompleted);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Returns a copy of this exception that records how many pages preceded the malformed one.
     */
    public MalformedPageException afterPages(int pagesCompleted) {
        return new MalformedPageException(reason, pagesCompleted);
    }
}
