package com.example.retrieval.pagination;

import com.example.retrieval.MalformedPageException;
import com.example.retrieval.RetrievalCancelledException;
import com.example.retrieval.RetrievalException;
import com.example.retrieval.TooManyPagesException;
import com.example.retrieval.model.Page;
import com.example.retrieval.model.RecordSet;
import com.example.retrieval.query.Query;
import com.example.retrieval.retry.RetryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Follows the cursor chain of one query until the service reports completion.
 *
 * <p>The loop fetches the first page, then keeps requesting the page behind the previous
 * page's cursor while that page is not done. Exactly one request is outstanding at any time:
 * page N+1 cannot be requested before page N's cursor is known.
 *
 * <p>Example usage:
 * <pre>{@code
 * PaginationLoop<Map<String, Object>> loop = new PaginationLoop<>(
 *     new PageFetcher<>(service, new RetryPolicy(RetryConfig.QUERY)),
 *     10_000
 * );
 * RecordSet<Map<String, Object>> all = loop.run(query);
 * }</pre>
 *
 * <p>Any failure aborts the whole retrieval with a {@link RetrievalException}; records already
 * accumulated are discarded.
 *
 * @param <T> the type of records
 */
public class PaginationLoop<T> {

    private static final Logger log = LoggerFactory.getLogger(PaginationLoop.class);

    private final PageFetcher<T> pageFetcher;
    private final int maxPages;

    /**
     * @param pageFetcher issues the page requests
     * @param maxPages upper bound on pages fetched for one query
     */
    public PaginationLoop(PageFetcher<T> pageFetcher, int maxPages) {
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be at least 1, got " + maxPages);
        }
        this.pageFetcher = Objects.requireNonNull(pageFetcher, "pageFetcher must not be null");
        this.maxPages = maxPages;
    }

    /**
     * Retrieves every record of the query without a cancellation signal.
     */
    public RecordSet<T> run(Query query) {
        return run(query, CancellationSignal.NONE);
    }

    /**
     * Retrieves every record of the query.
     *
     * @param query the query to run
     * @param cancellation checked before each page request
     * @return all records in page-arrival order
     * @throws RetrievalException if the retrieval fails for any reason
     */
    public RecordSet<T> run(Query query, CancellationSignal cancellation) {
        log.info("Executing query: {}", query);
        try {
            RecordSet<T> result = followCursors(query, cancellation);
            log.info("Query completed. Total records retrieved: {} in {} pages", result.size(), result.pageCount());
            return result;
        } catch (RetrievalException e) {
            log.error("Query execution failed: {}", e.getMessage());
            throw e;
        }
    }

    private RecordSet<T> followCursors(Query query, CancellationSignal cancellation) {
        ResultAccumulator<T> accumulator = new ResultAccumulator<>();
        try {
            checkNotCancelled(cancellation, accumulator);
            Page<T> page = pageFetcher.fetchFirst(query);
            accumulator.append(page.records());
            log.debug("Page 1 added {} records", page.size());

            if (page.hasNextPage()) {
                log.info("Query returned {} records initially, fetching remaining...", accumulator.size());
            }

            while (page.hasNextPage()) {
                if (accumulator.pageCount() >= maxPages) {
                    throw new TooManyPagesException(maxPages);
                }
                checkNotCancelled(cancellation, accumulator);

                page = pageFetcher.fetchNext(page.cursor());
                accumulator.append(page.records());
                log.debug("Page {} added {} records ({} total)",
                        accumulator.pageCount(), page.size(), accumulator.size());
            }

            return accumulator.collect();
        } catch (RetryException e) {
            throw RetrievalFailures.translate(e, accumulator.pageCount());
        } catch (MalformedPageException e) {
            throw e.afterPages(accumulator.pageCount());
        }
    }

    /**
     * Throws if the signal reports cancellation; records pages completed so far.
     */
    private static void checkNotCancelled(CancellationSignal cancellation, ResultAccumulator<?> accumulator) {
        if (cancellation.isCancelled()) {
            throw new RetrievalCancelledException(accumulator.pageCount());
        }
    }

    /**
     * Returns the upper bound on pages fetched for one query.
     */
    public int getMaxPages() {
        return maxPages;
    }
}
