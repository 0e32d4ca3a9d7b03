package com.example.retrieval.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw response of one query or query-more call, exactly as the service sent it.
 *
 * <p>Example API response:
 * <pre>
 * {
 *   "totalSize": 3512,
 *   "done": false,
 *   "nextRecordsUrl": "/services/data/v59.0/query/01gD0000002HU6KIAW-2000",
 *   "records": [ {...}, {...} ]
 * }
 * </pre>
 *
 * <p>Every field may be missing, in which case it is null. Interpreting missing fields is the
 * job of {@link Page#fromResponse(QueryResponse)}.
 *
 * @param <T> the type of the records
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse<T>(
        Integer totalSize,
        Boolean done,
        String nextRecordsUrl,
        List<T> records
) {
    @JsonCreator
    public QueryResponse(
            @JsonProperty("totalSize") Integer totalSize,
            @JsonProperty("done") Boolean done,
            @JsonProperty("nextRecordsUrl") String nextRecordsUrl,
            @JsonProperty("records") List<T> records
    ) {
        this.totalSize = totalSize;
        this.done = done;
        this.nextRecordsUrl = nextRecordsUrl;
        this.records = records;
    }

    /**
     * Creates a response that has more pages behind the given continuation token.
     */
    public static <T> QueryResponse<T> more(List<T> records, String nextRecordsUrl) {
        return new QueryResponse<>(null, false, nextRecordsUrl, records);
    }

    /**
     * Creates the final response of a query.
     */
    public static <T> QueryResponse<T> last(List<T> records) {
        return new QueryResponse<>(null, true, null, records);
    }
}
