package com.example.retrieval.pagination;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Checked before each page request. Once it reports cancellation no further request is issued.
 * A request already in flight is not interrupted.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();

    /**
     * Cancels once the clock reaches the deadline.
     */
    static CancellationSignal deadline(Instant deadline, Clock clock) {
        return () -> !clock.instant().isBefore(deadline);
    }

    /**
     * Cancels once the timeout has elapsed, measured from now on the system clock.
     */
    static CancellationSignal timeout(Duration timeout) {
        Clock clock = Clock.systemUTC();
        return deadline(clock.instant().plus(timeout), clock);
    }

    /**
     * A signal cancelled explicitly, possibly from another thread.
     */
    final class Flag implements CancellationSignal {

        private volatile boolean cancelled;

        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
