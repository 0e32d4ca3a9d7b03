package com.example.retrieval.retry;

import java.time.Duration;

/**
 * Blocking pause between two attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
