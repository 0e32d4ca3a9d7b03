package com.example.retrieval.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Executes a single network operation with a bounded number of attempts and a fixed,
 * blocking pause between them.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryPolicy policy = new RetryPolicy(RetryConfig.QUERY);
 * QueryResponse<Map<String, Object>> response =
 *     policy.execute("query", () -> service.query(query));
 * }</pre>
 *
 * <p>Every failed attempt is logged with its attempt number. Once the budget is used up a
 * {@link RetryExhaustedException} wrapping the last failure is thrown. Failures rejected by
 * the {@link RetryClassifier} stop immediately with a {@link RetryAbortedException}.
 *
 * <p><b>Thread Safety:</b> instances hold no mutable state and may be shared.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryConfig config;
    private final RetryClassifier classifier;
    private final Sleeper sleeper;
    private final Consumer<RetryAttempt> failureListener;

    /**
     * Creates a policy with the default classifier and a thread-blocking pause.
     *
     * @param config attempt count and delay
     */
    public RetryPolicy(RetryConfig config) {
        this(config, RetryClassifier.DEFAULT, Sleeper.THREAD);
    }

    /**
     * Creates a policy with a custom classifier and pause.
     */
    public RetryPolicy(RetryConfig config, RetryClassifier classifier, Sleeper sleeper) {
        this(config, classifier, sleeper, attempt -> { });
    }

    private RetryPolicy(
            RetryConfig config,
            RetryClassifier classifier,
            Sleeper sleeper,
            Consumer<RetryAttempt> failureListener
    ) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.failureListener = failureListener;
    }

    /**
     * Returns a copy of this policy that also reports every failed attempt to the given listener.
     */
    public RetryPolicy onFailedAttempt(Consumer<RetryAttempt> listener) {
        return new RetryPolicy(config, classifier, sleeper, failureListener.andThen(listener));
    }

    /**
     * Returns the attempt count and delay this policy applies.
     */
    public RetryConfig getConfig() {
        return config;
    }

    /**
     * Returns the classifier deciding which failures are repeated.
     */
    public RetryClassifier getClassifier() {
        return classifier;
    }

    /**
     * Runs the call until it succeeds or the attempt budget is used up.
     *
     * @param operation short name used in log lines and error messages
     * @param call the operation to run
     * @return the result of the first successful attempt
     * @throws RetryExhaustedException if all attempts failed
     * @throws RetryAbortedException if a failure was classified as permanent
     * @throws RetryInterruptedException if the thread was interrupted
     */
    public <R> R execute(String operation, RetryableCall<R> call) {
        int maxAttempts = config.maxAttempts();
        Throwable lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryInterruptedException(operation, attempt, e);
            } catch (Exception e) {
                lastFailure = e;
                log.warn("{} attempt {}/{} failed: {}", operation, attempt, maxAttempts, e.getMessage());
                failureListener.accept(new RetryAttempt(attempt, e));

                if (!classifier.isRetryable(e)) {
                    throw new RetryAbortedException(operation, attempt, e);
                }
                if (attempt < maxAttempts) {
                    pause(operation, attempt);
                }
            }
        }

        throw new RetryExhaustedException(operation, maxAttempts, lastFailure);
    }

    /**
     * Waits the configured delay before the next attempt.
     */
    private void pause(String operation, int attempt) {
        log.info("Retrying {} in {}ms...", operation, config.delay().toMillis());
        try {
            sleeper.sleep(config.delay());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryInterruptedException(operation, attempt, e);
        }
    }
}
