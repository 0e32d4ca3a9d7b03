package com.example.retrieval.streaming;

import com.example.retrieval.MalformedPageException;
import com.example.retrieval.RetrievalCancelledException;
import com.example.retrieval.TooManyPagesException;
import com.example.retrieval.model.Page;
import com.example.retrieval.pagination.CancellationSignal;
import com.example.retrieval.pagination.PageFetcher;
import com.example.retrieval.pagination.RetrievalFailures;
import com.example.retrieval.query.Query;
import com.example.retrieval.retry.RetryException;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.function.Consumer;

/**
 * A Spliterator that walks the cursor chain of one query lazily, one page at a time.
 *
 * <p>This is the streaming counterpart of
 * {@link com.example.retrieval.pagination.PaginationLoop}. It ensures that:
 * <ul>
 *   <li>Pages are only fetched when needed</li>
 *   <li>Only one page is held in memory at a time</li>
 *   <li>No request follows a page that reported completion</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * Spliterator<Map<String, Object>> spliterator = new RecordSpliterator<>(
 *     pageFetcher, query, 10_000, CancellationSignal.NONE
 * );
 * Stream<Map<String, Object>> records = StreamSupport.stream(spliterator, false);
 * }</pre>
 *
 * <p>Failures surface from {@link #tryAdvance} as {@link com.example.retrieval.RetrievalException}.
 * Records already handed downstream before a failure cannot be taken back.
 *
 * @param <T> the type of records
 */
public class RecordSpliterator<T> implements Spliterator<T> {

    private final PageFetcher<T> pageFetcher;
    private final Query query;
    private final int maxPages;
    private final CancellationSignal cancellation;

    private Page<T> currentPage;
    private Iterator<T> currentPageIterator;
    private int pagesFetched;

    public RecordSpliterator(
            PageFetcher<T> pageFetcher,
            Query query,
            int maxPages,
            CancellationSignal cancellation
    ) {
        this.pageFetcher = pageFetcher;
        this.query = query;
        this.maxPages = maxPages;
        this.cancellation = cancellation;
    }

    @Override
    public boolean tryAdvance(Consumer<? super T> action) {
        // Empty pages that are not done are skipped by fetching again
        while (currentPageIterator == null || !currentPageIterator.hasNext()) {
            if (!fetchNextPage()) {
                return false;
            }
        }
        action.accept(currentPageIterator.next());
        return true;
    }

    /**
     * @return false once the last page has been consumed
     */
    private boolean fetchNextPage() {
        // No request follows a done page
        if (currentPage != null && currentPage.done()) {
            return false;
        }
        // Cap and cancellation are checked before the request goes out
        if (currentPage != null && pagesFetched >= maxPages) {
            throw new TooManyPagesException(maxPages);
        }
        if (cancellation.isCancelled()) {
            throw new RetrievalCancelledException(pagesFetched);
        }

        // First page by query, the rest by the previous page's cursor
        try {
            currentPage = currentPage == null
                    ? pageFetcher.fetchFirst(query)
                    : pageFetcher.fetchNext(currentPage.cursor());
        } catch (RetryException e) {
            throw RetrievalFailures.translate(e, pagesFetched);
        } catch (MalformedPageException e) {
            throw e.afterPages(pagesFetched);
        }
        // Drop the previous page's records; only this one stays referenced
        pagesFetched++;
        currentPageIterator = currentPage.records().iterator();
        return true;
    }

    /**
     * Returns null: page N+1 cannot be requested before page N's cursor is known.
     */
    @Override
    public Spliterator<T> trySplit() {
        return null;
    }

    @Override
    public long estimateSize() {
        return Long.MAX_VALUE;
    }

    /**
     * ORDERED and IMMUTABLE; not SIZED because the total is unknown upfront.
     */
    @Override
    public int characteristics() {
        return ORDERED | IMMUTABLE;
    }

    /**
     * Returns the number of pages received so far.
     */
    public int getPagesFetched() {
        return pagesFetched;
    }
}
