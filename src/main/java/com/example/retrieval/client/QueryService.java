package com.example.retrieval.client;

import com.example.retrieval.model.QueryResponse;
import com.example.retrieval.query.Query;

import java.io.IOException;

/**
 * The remote query service that pages large answers behind a continuation token.
 *
 * <p>Either call may fail with a transient error (network, rate limiting). Implementations
 * that can tell transient from permanent failures throw a {@link QueryServiceException}.
 * An implementation holding connection state must be safe to call from one thread at a time.
 *
 * @param <T> the type of records returned
 */
public interface QueryService<T> {

    /**
     * Executes a fresh query and returns its first page.
     */
    QueryResponse<T> query(Query query) throws IOException, InterruptedException;

    /**
     * Returns the page behind a continuation token from a previous response.
     */
    QueryResponse<T> queryMore(String continuationToken) throws IOException, InterruptedException;
}
