package com.example.retrieval.pagination;

import com.example.retrieval.model.RecordSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Appends each page's records, in received order, to a running sequence.
 * Appending is amortized constant time per record. Not thread-safe.
 *
 * @param <T> the type of records
 */
public class ResultAccumulator<T> {

    private final List<T> records = new ArrayList<>();
    private int pageCount;

    /**
     * Adds one page of records to the tail of the sequence.
     */
    public void append(List<? extends T> pageRecords) {
        records.addAll(pageRecords);
        pageCount++;
    }

    public int size() {
        return records.size();
    }

    public int pageCount() {
        return pageCount;
    }

    /**
     * Returns the finished sequence. Later appends do not affect the returned value.
     */
    public RecordSet<T> collect() {
        return new RecordSet<>(records, pageCount);
    }
}
