package com.example.retrieval.query;

import java.util.Objects;

/**
 * A fully built query, treated as opaque text by the retrieval engine.
 *
 * @param text the query text, sent to the service as-is
 */
public record Query(String text) {

    public Query {
        Objects.requireNonNull(text, "text must not be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("query text must not be blank");
        }
    }

    public static Query of(String text) {
        return new Query(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
