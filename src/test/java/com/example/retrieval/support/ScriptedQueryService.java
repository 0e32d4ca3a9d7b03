package com.example.retrieval.support;

import com.example.retrieval.client.QueryService;
import com.example.retrieval.model.QueryResponse;
import com.example.retrieval.query.Query;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * In-memory query service that plays back a fixed script of responses and failures,
 * one step per call, and records every call it receives.
 *
 * <p>A call past the end of the script fails with an {@link AssertionError}, which no retry
 * policy catches, so an unexpected extra request fails the test.
 *
 * @param <T> the type of records
 */
public class ScriptedQueryService<T> implements QueryService<T> {

    private final Deque<Step<T>> script = new ArrayDeque<>();
    private final List<Call> calls = new ArrayList<>();

    public ScriptedQueryService<T> thenRespond(QueryResponse<T> response) {
        script.add(new Step<>(response, null));
        return this;
    }

    public ScriptedQueryService<T> thenFail(Exception failure) {
        script.add(new Step<>(null, failure));
        return this;
    }

    public ScriptedQueryService<T> thenFail(int times, Exception failure) {
        for (int i = 0; i < times; i++) {
            thenFail(failure);
        }
        return this;
    }

    @Override
    public QueryResponse<T> query(Query query) throws IOException, InterruptedException {
        return next(new Call("query", query.text()));
    }

    @Override
    public QueryResponse<T> queryMore(String continuationToken) throws IOException, InterruptedException {
        return next(new Call("queryMore", continuationToken));
    }

    private synchronized QueryResponse<T> next(Call call) throws IOException, InterruptedException {
        calls.add(call);
        Step<T> step = script.poll();
        if (step == null) {
            throw new AssertionError("Unexpected call past the end of the script: " + call);
        }
        if (step.failure() != null) {
            Exception failure = step.failure();
            if (failure instanceof IOException io) {
                throw io;
            }
            if (failure instanceof InterruptedException interrupted) {
                throw interrupted;
            }
            if (failure instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(failure);
        }
        return step.response();
    }

    public synchronized List<Call> calls() {
        return List.copyOf(calls);
    }

    public synchronized int callCount() {
        return calls.size();
    }

    public synchronized long callCount(String operation) {
        return calls.stream().filter(c -> c.operation().equals(operation)).count();
    }

    public synchronized boolean isExhausted() {
        return script.isEmpty();
    }

    public record Call(String operation, String argument) {
    }

    private record Step<T>(QueryResponse<T> response, Exception failure) {
    }
}
