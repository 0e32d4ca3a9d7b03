package com.example.retrieval.reactor;

import com.example.retrieval.MalformedPageException;
import com.example.retrieval.RetrievalCancelledException;
import com.example.retrieval.RetrievalException;
import com.example.retrieval.RetrievalOptions;
import com.example.retrieval.TooManyPagesException;
import com.example.retrieval.client.QueryService;
import com.example.retrieval.model.Page;
import com.example.retrieval.model.QueryResponse;
import com.example.retrieval.model.RecordSet;
import com.example.retrieval.pagination.ResultAccumulator;
import com.example.retrieval.pagination.RetrievalFailures;
import com.example.retrieval.query.Query;
import com.example.retrieval.retry.RetryAbortedException;
import com.example.retrieval.retry.RetryClassifier;
import com.example.retrieval.retry.RetryConfig;
import com.example.retrieval.retry.RetryException;
import com.example.retrieval.retry.RetryExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reactive retrieval using Project Reactor.
 *
 * <p>This is the Reactor-based equivalent of {@link com.example.retrieval.RecordRetriever}.
 * The blocking service calls run on the bounded elastic scheduler, and the pause between
 * attempts is a scheduled timer ({@link Retry#fixedDelay}) instead of a sleeping thread, so
 * disposing the subscription cancels a retrieval that is waiting to retry.
 *
 * <p>Example usage:
 * <pre>{@code
 * ReactorRecordRetriever<Map<String, Object>> retriever = new ReactorRecordRetriever<>(service);
 *
 * retriever.retrieve(query, RetrievalOptions.defaults())
 *     .subscribe(records -> report.write(records));
 *
 * // Blocking for testing
 * RecordSet<Map<String, Object>> all = retriever.retrieve(query, options).block();
 * }</pre>
 *
 * <p>Pages are still fetched strictly one after another: each continuation is subscribed
 * only after the page carrying its cursor has been emitted.
 *
 * @param <T> the type of records
 */
public class ReactorRecordRetriever<T> {

    private static final Logger log = LoggerFactory.getLogger(ReactorRecordRetriever.class);

    private final QueryService<T> service;
    private final RetryClassifier classifier;

    public ReactorRecordRetriever(QueryService<T> service) {
        this(service, RetryClassifier.DEFAULT);
    }

    public ReactorRecordRetriever(QueryService<T> service, RetryClassifier classifier) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Retrieves every record of the query.
     *
     * @return Mono that emits all records in page-arrival order, or a
     *         {@link RetrievalException}; never a partial result
     */
    public Mono<RecordSet<T>> retrieve(Query query, RetrievalOptions options) {
        return Mono.defer(() -> {
            log.info("Executing query: {}", query);
            ResultAccumulator<T> accumulator = new ResultAccumulator<>();
            return pages(query, options)
                    .doOnNext(page -> accumulator.append(page.records()))
                    .then(Mono.fromSupplier(accumulator::collect))
                    .doOnNext(result -> log.info("Query completed. Total records retrieved: {} in {} pages",
                            result.size(), result.pageCount()))
                    .doOnError(RetrievalException.class,
                            e -> log.error("Query execution failed: {}", e.getMessage()));
        });
    }

    public Mono<RecordSet<T>> retrieve(Query query, RetryConfig retryConfig) {
        return retrieve(query, RetrievalOptions.of(retryConfig));
    }

    /**
     * Returns a Flux of every record of the query. Pages are fetched as downstream demand
     * arrives; {@code take()} stops further requests.
     */
    public Flux<T> streamRecords(Query query, RetrievalOptions options) {
        return pages(query, options)
                .concatMapIterable(Page::records);
    }

    /**
     * Returns the pages of the query, following the cursor chain until a page is done.
     */
    public Flux<Page<T>> pages(Query query, RetrievalOptions options) {
        return Flux.defer(() -> {
            AtomicInteger pagesCompleted = new AtomicInteger();
            return fetch("Query", () -> service.query(query), options, pagesCompleted)
                    .expand(page -> {
                        if (page.done()) {
                            return Mono.empty();
                        }
                        if (pagesCompleted.get() >= options.maxPages()) {
                            return Mono.error(new TooManyPagesException(options.maxPages()));
                        }
                        return fetch("QueryMore", () -> service.queryMore(page.cursor()), options, pagesCompleted);
                    });
        });
    }

    private Mono<Page<T>> fetch(
            String operation,
            Callable<QueryResponse<T>> call,
            RetrievalOptions options,
            AtomicInteger pagesCompleted
    ) {
        RetryConfig retry = options.retry();
        return Mono.defer(() -> {
            if (options.cancellation().isCancelled()) {
                return Mono.error(new RetrievalCancelledException(pagesCompleted.get()));
            }

            AtomicInteger attempts = new AtomicInteger();
            return Mono.fromCallable(() -> {
                        attempts.incrementAndGet();
                        return call.call();
                    })
                    .subscribeOn(Schedulers.boundedElastic())
                    .doOnError(e -> log.warn("{} attempt {}/{} failed: {}",
                            operation, attempts.get(), retry.maxAttempts(), e.getMessage()))
                    .retryWhen(Retry.fixedDelay(retry.maxAttempts() - 1, retry.delay())
                            .filter(classifier::isRetryable)
                            .onRetryExhaustedThrow((spec, signal) ->
                                    new RetryExhaustedException(operation, attempts.get(), signal.failure())))
                    .onErrorMap(e -> !(e instanceof RetryException),
                            e -> new RetryAbortedException(operation, attempts.get(), e))
                    .onErrorMap(RetryException.class,
                            e -> RetrievalFailures.translate(e, pagesCompleted.get()))
                    .map(Page::fromResponse)
                    .switchIfEmpty(Mono.fromSupplier(() -> Page.<T>last(List.of())))
                    .onErrorMap(MalformedPageException.class, e -> e.afterPages(pagesCompleted.get()))
                    .doOnNext(page -> pagesCompleted.incrementAndGet());
        });
    }
}
