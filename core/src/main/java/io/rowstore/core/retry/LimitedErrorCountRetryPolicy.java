// file: core/src/main/java/io/rowstore/core/retry/LimitedErrorCountRetryPolicy.java
package io.rowstore.core.retry;

import io.grpc.Status;

/**
 * Allows up to {@code maxFailures} retryable failures.
 * A non-retryable status stops immediately, whatever the count.
 */
public final class LimitedErrorCountRetryPolicy implements RetryPolicy {

    private final int maxFailures;
    private int failures;

    public LimitedErrorCountRetryPolicy(int maxFailures) {
        if (maxFailures < 0) {
            throw new IllegalArgumentException("maxFailures must be >= 0");
        }
        this.maxFailures = maxFailures;
    }

    @Override
    public boolean onFailure(Status status) {
        if (!RetryPolicy.isRetryable(status)) {
            return false;
        }
        failures++;
        return failures <= maxFailures;
    }

    @Override
    public LimitedErrorCountRetryPolicy clone() {
        return new LimitedErrorCountRetryPolicy(maxFailures);
    }

    public int maxFailures() {
        return maxFailures;
    }

    @Override
    public String toString() {
        return "LimitedErrorCountRetryPolicy{maxFailures=" + maxFailures + ", failures=" + failures + "}";
    }
}
