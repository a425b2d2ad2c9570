// file: core/src/main/java/io/rowstore/core/retry/ExponentialBackoffPolicy.java
package io.rowstore.core.retry;

import io.grpc.Status;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff: returns the current delay, then doubles it for the next
 * call, capped at {@code maximum}. The delay never drops below {@code initial}.
 * <p>
 * Example: initial=10ms, maximum=50ms gives 10, 20, 40, 50, 50, ...
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {

    private final Duration initial;
    private final Duration maximum;
    private Duration current;

    public ExponentialBackoffPolicy(Duration initial, Duration maximum) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(maximum, "maximum");
        if (initial.isNegative()) {
            throw new IllegalArgumentException("initial must not be negative, got: " + initial);
        }
        if (maximum.compareTo(initial) < 0) {
            throw new IllegalArgumentException("maximum (" + maximum + ") must be >= initial (" + initial + ")");
        }
        this.initial = initial;
        this.maximum = maximum;
        this.current = initial;
    }

    @Override
    public Duration onCompletion(Status status) {
        Duration delay = current;
        Duration doubled = current.multipliedBy(2);
        current = doubled.compareTo(maximum) > 0 ? maximum : doubled;
        if (current.compareTo(initial) < 0) {
            current = initial;
        }
        return delay;
    }

    @Override
    public ExponentialBackoffPolicy clone() {
        return new ExponentialBackoffPolicy(initial, maximum);
    }

    public Duration initial() {
        return initial;
    }

    public Duration maximum() {
        return maximum;
    }

    @Override
    public String toString() {
        return "ExponentialBackoffPolicy{initial=" + initial + ", maximum=" + maximum + ", current=" + current + "}";
    }
}
