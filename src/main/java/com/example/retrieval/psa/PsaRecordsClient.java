package com.example.retrieval.psa;

import com.example.retrieval.RecordRetriever;
import com.example.retrieval.RetrievalOptions;
import com.example.retrieval.client.QueryService;
import com.example.retrieval.model.RecordSet;
import com.example.retrieval.retry.RetryConfig;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

/**
 * Timecard and project lookups. Both go through the same {@link RecordRetriever}, so they
 * share one retry and pagination implementation.
 */
public class PsaRecordsClient {

    private final RecordRetriever<Map<String, Object>> retriever;
    private final RetrievalOptions options;

    public PsaRecordsClient(QueryService<Map<String, Object>> service) {
        this(new RecordRetriever<>(service), RetrievalOptions.of(RetryConfig.QUERY));
    }

    public PsaRecordsClient(RecordRetriever<Map<String, Object>> retriever, RetrievalOptions options) {
        this.retriever = Objects.requireNonNull(retriever, "retriever must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public RecordSet<Map<String, Object>> queryTimecards(
            String opportunityNumber,
            LocalDate startDate,
            LocalDate endDate
    ) {
        return retriever.retrieve(PsaQueries.timecards(opportunityNumber, startDate, endDate), options);
    }

    public RecordSet<Map<String, Object>> queryProjects(String opportunityNumber) {
        return retriever.retrieve(PsaQueries.projects(opportunityNumber), options);
    }
}
