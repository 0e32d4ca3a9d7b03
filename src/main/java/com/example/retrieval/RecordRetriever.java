package com.example.retrieval;

import com.example.retrieval.client.HttpQueryService;
import com.example.retrieval.client.QueryService;
import com.example.retrieval.model.RecordSet;
import com.example.retrieval.pagination.PageFetcher;
import com.example.retrieval.pagination.PaginationLoop;
import com.example.retrieval.query.Query;
import com.example.retrieval.retry.RetryClassifier;
import com.example.retrieval.retry.RetryConfig;
import com.example.retrieval.retry.RetryPolicy;
import com.example.retrieval.retry.Sleeper;
import com.example.retrieval.streaming.RecordSpliterator;

import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Main facade for retrieving complete result sets from a paginated query service.
 *
 * <p>Example usage:
 * <pre>{@code
 * // With HTTP client
 * RecordRetriever<Map<String, Object>> retriever = new RecordRetriever<>(
 *     HttpQueryService.untyped(config, tokenSupplier)
 * );
 * RecordSet<Map<String, Object>> all = retriever.retrieve(query, RetryConfig.QUERY);
 *
 * // Lazily, one page in memory at a time
 * long count = retriever.stream(query, RetrievalOptions.defaults()).count();
 * }</pre>
 *
 * <p>Independent retrievals share nothing but the {@link QueryService}.
 *
 * @param <T> the type of records
 */
public class RecordRetriever<T> {

    private final QueryService<T> service;
    private final RetryClassifier classifier;
    private final Sleeper sleeper;

    /**
     * Creates a retriever with the default classifier and a blocking pause between attempts.
     *
     * @param service the query service, for example an {@link HttpQueryService}
     */
    public RecordRetriever(QueryService<T> service) {
        this(service, RetryClassifier.DEFAULT, Sleeper.THREAD);
    }

    public RecordRetriever(QueryService<T> service, RetryClassifier classifier, Sleeper sleeper) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public RecordSet<T> retrieve(Query query) {
        return retrieve(query, RetrievalOptions.defaults());
    }

    /**
     * Retrieves every record of the query.
     *
     * @param query the query to run
     * @param retryConfig attempts and delay for each page request
     * @return all records, in page-arrival order
     * @throws RetrievalException if the retrieval fails; no partial result is returned
     */
    public RecordSet<T> retrieve(Query query, RetryConfig retryConfig) {
        return retrieve(query, RetrievalOptions.of(retryConfig));
    }

    public RecordSet<T> retrieve(Query query, RetrievalOptions options) {
        return new PaginationLoop<>(pageFetcher(options), options.maxPages())
                .run(query, options.cancellation());
    }

    /**
     * Returns a lazy stream over every record of the query. Pages are requested as records are
     * consumed, so early termination (limit, findFirst) stops fetching.
     */
    public Stream<T> stream(Query query, RetrievalOptions options) {
        RecordSpliterator<T> spliterator = new RecordSpliterator<>(
                pageFetcher(options),
                query,
                options.maxPages(),
                options.cancellation()
        );
        return StreamSupport.stream(spliterator, false);
    }

    private PageFetcher<T> pageFetcher(RetrievalOptions options) {
        return new PageFetcher<>(service, new RetryPolicy(options.retry(), classifier, sleeper));
    }
}
