package com.example.retrieval.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The complete, ordered result of one retrieval.
 *
 * <p>Records appear in page-arrival order and, within a page, in the order the service sent
 * them. Nothing is deduplicated or sorted. The caller owns the returned value.
 *
 * @param records every record across all pages
 * @param pageCount number of pages fetched
 * @param <T> the type of records
 */
public record RecordSet<T>(
        List<T> records,
        int pageCount
) implements Iterable<T> {

    public RecordSet {
        records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public static <T> RecordSet<T> empty() {
        return new RecordSet<>(List.of(), 0);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public Iterator<T> iterator() {
        return records.iterator();
    }
}
