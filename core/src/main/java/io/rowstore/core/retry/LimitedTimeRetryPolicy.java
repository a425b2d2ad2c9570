// file: core/src/main/java/io/rowstore/core/retry/LimitedTimeRetryPolicy.java
package io.rowstore.core.retry;

import io.grpc.Status;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Allows retries until the wall clock passes a deadline fixed at construction
 * ({@code clock.instant() + maxDuration}). A non-retryable status stops immediately.
 * <p>
 * {@link #deadline()} and {@link #remaining()} are exposed so callers can cap
 * each attempt's RPC deadline and each backoff pause with them.
 */
public final class LimitedTimeRetryPolicy implements RetryPolicy {

    private final Duration maxDuration;
    private final Clock clock;
    private final Instant deadline;

    public LimitedTimeRetryPolicy(Duration maxDuration) {
        this(maxDuration, Clock.systemUTC());
    }

    public LimitedTimeRetryPolicy(Duration maxDuration, Clock clock) {
        Objects.requireNonNull(maxDuration, "maxDuration");
        if (maxDuration.isNegative()) {
            throw new IllegalArgumentException("maxDuration must not be negative, got: " + maxDuration);
        }
        this.maxDuration = maxDuration;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.deadline = clock.instant().plus(maxDuration);
    }

    @Override
    public boolean onFailure(Status status) {
        if (!RetryPolicy.isRetryable(status)) {
            return false;
        }
        return clock.instant().isBefore(deadline);
    }

    @Override
    public LimitedTimeRetryPolicy clone() {
        return new LimitedTimeRetryPolicy(maxDuration, clock);
    }

    public Instant deadline() {
        return deadline;
    }

    /** Time left before the deadline, by this policy's clock; never negative. */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public Duration maxDuration() {
        return maxDuration;
    }

    @Override
    public String toString() {
        return "LimitedTimeRetryPolicy{maxDuration=" + maxDuration + ", deadline=" + deadline + "}";
    }
}
