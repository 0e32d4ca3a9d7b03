package com.example.retrieval;

/**
 * The service kept reporting more data past the configured page cap.
 */
public class TooManyPagesException extends RetrievalException {

    private final int maxPages;

    public TooManyPagesException(int maxPages) {
        super("Service still reported more data after " + maxPages + " pages", maxPages);
        this.maxPages = maxPages;
    }

    public int getMaxPages() {
        return maxPages;
    }
}
