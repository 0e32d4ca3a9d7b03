package com.example.retrieval.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for retry behavior: a fixed number of attempts with a fixed pause between them.
 *
 * <p>Two presets cover the call sites seen in practice:
 * <ul>
 *   <li>{@link #QUERY} - query and query-more calls, 3 attempts, 1 second apart</li>
 *   <li>{@link #EXPORT} - document export downloads, 5 attempts, 3 seconds apart</li>
 * </ul>
 *
 * @param maxAttempts total number of attempts, including the first one
 * @param delay pause between two consecutive attempts
 */
public record RetryConfig(
        int maxAttempts,
        Duration delay
) {
    public static final RetryConfig QUERY = new RetryConfig(3, Duration.ofMillis(1000));

    public static final RetryConfig EXPORT = new RetryConfig(5, Duration.ofMillis(3000));

    public RetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative, got " + delay);
        }
    }

    /**
     * Returns the {@link #QUERY} preset.
     */
    public static RetryConfig defaults() {
        return QUERY;
    }

    /**
     * Returns a configuration with a single attempt and no pause.
     */
    public static RetryConfig noRetry() {
        return new RetryConfig(1, Duration.ZERO);
    }

    /**
     * Creates a configuration from an attempt count and a delay in milliseconds.
     */
    public static RetryConfig of(int maxAttempts, long delayMillis) {
        return new RetryConfig(maxAttempts, Duration.ofMillis(delayMillis));
    }
}
