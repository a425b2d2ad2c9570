// file: core/src/main/java/io/rowstore/core/FailedMutation.java
package io.rowstore.core;

import io.grpc.Status;

import java.util.Objects;

/**
 * Terminal outcome of one entry of a bulk mutation that could not be applied.
 *
 * @param originalIndex position of the entry in the caller's batch
 * @param mutation      the entry itself
 * @param status        last status attributed to the entry
 * @param cause         why the client stopped trying
 */
public record FailedMutation(int originalIndex, SingleRowMutation mutation, Status status, Cause cause) {

    public enum Cause {
        /** The server reported a non-retryable status for the entry. */
        SERVER_REJECTED,
        /** A retryable status was reported, but resending the entry is not safe. */
        NOT_IDEMPOTENT,
        /**
         * No usable status arrived and the entry cannot be resent: it is not
         * idempotent, or the server broke the response protocol. It may or may
         * not have been applied.
         */
        UNCONFIRMED,
        /** The retry policy refused another attempt while the entry was still pending. */
        RETRY_BUDGET_EXHAUSTED
    }

    public FailedMutation {
        if (originalIndex < 0) {
            throw new IllegalArgumentException("originalIndex must be >= 0");
        }
        Objects.requireNonNull(mutation, "mutation");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(cause, "cause");
    }

    public boolean retryBudgetExhausted() {
        return cause == Cause.RETRY_BUDGET_EXHAUSTED;
    }
}
