package com.example.retrieval.model;

import com.example.retrieval.MalformedPageException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One parsed page of a retrieval: its records plus completion metadata.
 *
 * <p>{@code cursor} is present exactly when {@code done} is false, and it is passed back to the
 * service verbatim to request the next page.
 *
 * @param <T> the type of records in the page
 */
public record Page<T>(
        List<T> records,
        boolean done,
        String cursor
) {
    public Page {
        records = records != null ? Collections.unmodifiableList(new ArrayList<>(records)) : List.of();
        if (!done && isBlank(cursor)) {
            throw new IllegalArgumentException("A page that is not done must carry a cursor");
        }
        if (done) {
            cursor = null;
        }
    }

    /**
     * Creates a page with more pages behind the given cursor.
     */
    public static <T> Page<T> of(List<T> records, String cursor) {
        return new Page<>(records, false, cursor);
    }

    /**
     * Creates the last page (no more pages after this).
     */
    public static <T> Page<T> last(List<T> records) {
        return new Page<>(records, true, null);
    }

    /**
     * Parses a raw service response.
     *
     * <ul>
     *   <li>missing {@code records} means an empty page</li>
     *   <li>missing {@code done}, or {@code done == true}, means the final page</li>
     *   <li>{@code done == false} without a continuation token is a protocol violation</li>
     * </ul>
     *
     * @throws MalformedPageException if more data is announced without a cursor
     */
    public static <T> Page<T> fromResponse(QueryResponse<T> response) {
        if (response == null) {
            return last(List.of());
        }
        if (Boolean.FALSE.equals(response.done())) {
            if (isBlank(response.nextRecordsUrl())) {
                throw new MalformedPageException("done=false without a continuation token");
            }
            return of(response.records(), response.nextRecordsUrl());
        }
        return last(response.records());
    }

    public boolean hasNextPage() {
        return !done;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
