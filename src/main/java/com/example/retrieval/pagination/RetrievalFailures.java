package com.example.retrieval.pagination;

import com.example.retrieval.PermanentFailureException;
import com.example.retrieval.RetrievalCancelledException;
import com.example.retrieval.RetrievalException;
import com.example.retrieval.RetrievalExhaustedException;
import com.example.retrieval.retry.RetryAbortedException;
import com.example.retrieval.retry.RetryException;
import com.example.retrieval.retry.RetryExhaustedException;
import com.example.retrieval.retry.RetryInterruptedException;

/**
 * Maps retry outcomes onto the retrieval error taxonomy.
 */
public final class RetrievalFailures {

    private RetrievalFailures() {
    }

    /**
     * @param failure what the retry policy gave up with
     * @param pagesCompleted pages fully received before the failing request
     */
    public static RetrievalException translate(RetryException failure, int pagesCompleted) {
        if (failure instanceof RetryExhaustedException) {
            return new RetrievalExhaustedException(failure.getAttempts(), pagesCompleted, failure.getCause());
        }
        if (failure instanceof RetryAbortedException) {
            return new PermanentFailureException(failure.getAttempts(), pagesCompleted, failure.getCause());
        }
        if (failure instanceof RetryInterruptedException) {
            return new RetrievalCancelledException(pagesCompleted, failure.getCause());
        }
        throw new IllegalArgumentException("Unknown retry failure: " + failure.getClass().getName(), failure);
    }
}
