package com.example.retrieval.streaming;

import com.example.retrieval.MalformedPageException;
import com.example.retrieval.RetrievalCancelledException;
import com.example.retrieval.RetrievalExhaustedException;
import com.example.retrieval.TooManyPagesException;
import com.example.retrieval.model.QueryResponse;
import com.example.retrieval.pagination.CancellationSignal;
import com.example.retrieval.pagination.PageFetcher;
import com.example.retrieval.query.Query;
import com.example.retrieval.retry.RetryClassifier;
import com.example.retrieval.retry.RetryConfig;
import com.example.retrieval.retry.RetryPolicy;
import com.example.retrieval.support.RecordingSleeper;
import com.example.retrieval.support.ScriptedQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Spliterator;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for RecordSpliterator - lazy, page-at-a-time streaming of a query's records.
 */
class RecordSpliteratorTest {

    private static final Query QUERY = Query.of("SELECT Id FROM pse__Proj__c");

    // =========================================================================
    // BASIC STREAMING
    // =========================================================================

    @Test
    @DisplayName("Should stream all records from multiple pages, skipping over empty pages")
    void shouldStreamAllRecords() {
        ScriptedQueryService<String> service = new ScriptedQueryService<String>()
                .thenRespond(QueryResponse.more(List.of("r1", "r2"), "c1"))
                .thenRespond(QueryResponse.more(List.of(), "c2"))
                .thenRespond(QueryResponse.last(List.of("r3")));

        List<String> records = StreamSupport.stream(spliterator(service, 100), false)
                .collect(Collectors.toList());

        assertThat(records).containsExactly("r1", "r2", "r3");
        assertThat(service.callCount()).isEqualTo(3);
    }

    // =========================================================================
    // LAZY EVALUATION
    // =========================================================================

    @Test
    @DisplayName("Should fetch pages only when records are consumed")
    void shouldFetchLazily() {
        ScriptedQueryService<String> service = new ScriptedQueryService<String>()
                .thenRespond(QueryResponse.more(List.of("r1", "r2"), "c1"))
                .thenRespond(QueryResponse.last(List.of("r3")));
        RecordSpliterator<String> spliterator = spliterator(service, 100);

        // When: creating the stream - nothing fetched yet
        var stream = StreamSupport.stream(spliterator, false);
        assertThat(service.callCount()).isZero();

        // When: taking the first record - one page fetched
        assertThat(stream.findFirst()).contains("r1");
        assertThat(service.callCount()).isEqualTo(1);
        assertThat(spliterator.getPagesFetched()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not request anything after a done page")
    void shouldStopAfterDonePage() {
        ScriptedQueryService<String> service = new ScriptedQueryService<String>()
                .thenRespond(QueryResponse.last(List.of()));
        RecordSpliterator<String> spliterator = spliterator(service, 100);

        assertThat(spliterator.tryAdvance(record -> { })).isFalse();
        assertThat(spliterator.tryAdvance(record -> { })).isFalse();
        assertThat(service.callCount()).isEqualTo(1);
    }

    // =========================================================================
    // FAILURES
    // =========================================================================

    @Test
    @DisplayName("Should surface exhaustion as a retrieval error")
    void shouldSurfaceExhaustion() {
        ScriptedQueryService<String> service = new ScriptedQueryService<String>()
                .thenRespond(QueryResponse.more(List.of("r1"), "c1"))
                .thenFail(3, new IOException("timeout"));

        assertThatThrownBy(() -> StreamSupport.stream(spliterator(service, 100), false).count())
                .isInstanceOf(RetrievalExhaustedException.class)
                .extracting(e -> ((RetrievalExhaustedException) e).getPagesCompleted())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("Should surface a malformed page")
    void shouldSurfaceMalformedPage() {
        ScriptedQueryService<String> service = new ScriptedQueryService<String>()
                .thenRespond(new QueryResponse<>(null, false, null, List.of("r1")));

        assertThatThrownBy(() -> StreamSupport.stream(spliterator(service, 100), false).count())
                .isInstanceOf(MalformedPageException.class);
        assertThat(service.callCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should enforce the page cap")
    void shouldEnforcePageCap() {
        ScriptedQueryService<String> service = new ScriptedQueryService<String>()
                .thenRespond(QueryResponse.more(List.of("r1"), "c1"))
                .thenRespond(QueryResponse.more(List.of("r2"), "c2"));

        assertThatThrownBy(() -> StreamSupport.stream(spliterator(service, 2), false).count())
                .isInstanceOf(TooManyPagesException.class);
        assertThat(service.callCount()).isEqualTo(2);
    }

    // =========================================================================
    // CANCELLATION
    // =========================================================================

    @Test
    @DisplayName("Should not request the next page once cancelled mid-stream")
    void shouldStopWhenCancelled() {
        // Given: two pages available, consumer cancels after the first record
        ScriptedQueryService<String> service = new ScriptedQueryService<String>()
                .thenRespond(QueryResponse.more(List.of("r1"), "c1"))
                .thenRespond(QueryResponse.last(List.of("r2")));
        CancellationSignal.Flag flag = new CancellationSignal.Flag();
        RecordSpliterator<String> spliterator = spliterator(service, 100, flag);

        assertThat(spliterator.tryAdvance(record -> flag.cancel())).isTrue();

        // When/Then: the next advance needs page 2 and fails instead of requesting it
        assertThatThrownBy(() -> spliterator.tryAdvance(record -> { }))
                .isInstanceOf(RetrievalCancelledException.class)
                .extracting(e -> ((RetrievalCancelledException) e).getPagesCompleted())
                .isEqualTo(1);
        assertThat(service.callCount("queryMore")).isZero();
    }

    // =========================================================================
    // SPLITERATOR CHARACTERISTICS
    // =========================================================================

    @Test
    @DisplayName("Should be ordered and not splittable")
    void shouldReportCharacteristics() {
        RecordSpliterator<String> spliterator = spliterator(new ScriptedQueryService<>(), 100);

        assertThat(spliterator.hasCharacteristics(Spliterator.ORDERED)).isTrue();
        assertThat(spliterator.hasCharacteristics(Spliterator.SIZED)).isFalse();
        assertThat(spliterator.trySplit()).isNull();
    }

    // =========================================================================
    // HELPER METHODS
    // =========================================================================

    private RecordSpliterator<String> spliterator(ScriptedQueryService<String> service, int maxPages) {
        return spliterator(service, maxPages, CancellationSignal.NONE);
    }

    private RecordSpliterator<String> spliterator(
            ScriptedQueryService<String> service,
            int maxPages,
            CancellationSignal cancellation
    ) {
        PageFetcher<String> fetcher = new PageFetcher<>(service,
                new RetryPolicy(RetryConfig.QUERY, RetryClassifier.DEFAULT, new RecordingSleeper()));
        return new RecordSpliterator<>(fetcher, QUERY, maxPages, cancellation);
    }
}
