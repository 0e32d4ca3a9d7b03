package com.example.retrieval.pagination;

import com.example.retrieval.MalformedPageException;
import com.example.retrieval.client.QueryService;
import com.example.retrieval.model.Page;
import com.example.retrieval.query.Query;
import com.example.retrieval.retry.RetryPolicy;

import java.util.Objects;

/**
 * Issues one first-page or continuation request through a {@link RetryPolicy} and parses the
 * response into a {@link Page}.
 *
 * <p>Parsing happens after the retry policy returns, so a malformed page is reported
 * once and never retried.
 *
 * @param <T> the type of records in each page
 */
public class PageFetcher<T> {

    private final QueryService<T> service;
    private final RetryPolicy retryPolicy;

    public PageFetcher(QueryService<T> service, RetryPolicy retryPolicy) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }

    /**
     * Runs the query and returns its first page.
     *
     * @throws MalformedPageException if the page announces more data without a cursor
     * @throws com.example.retrieval.retry.RetryException if the request could not be completed
     */
    public Page<T> fetchFirst(Query query) {
        Objects.requireNonNull(query, "query must not be null");
        return Page.fromResponse(retryPolicy.execute("Query", () -> service.query(query)));
    }

    /**
     * Returns the page behind the given cursor. The cursor is passed to the service verbatim.
     *
     * @throws MalformedPageException if the page announces more data without a cursor
     * @throws com.example.retrieval.retry.RetryException if the request could not be completed
     */
    public Page<T> fetchNext(String cursor) {
        Objects.requireNonNull(cursor, "cursor must not be null");
        return Page.fromResponse(retryPolicy.execute("QueryMore", () -> service.queryMore(cursor)));
    }

    /**
     * Returns the policy each request runs under.
     */
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
}
