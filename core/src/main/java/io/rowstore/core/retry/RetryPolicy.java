// file: core/src/main/java/io/rowstore/core/retry/RetryPolicy.java
package io.rowstore.core.retry;

import io.grpc.Status;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether a logical operation may be attempted again after a failure.
 * <p>
 * Contract:
 *  - Implementations are stateful (failure counter, deadline). State starts at
 *    construction and the policy is exhausted once {@link #onFailure} returns false.
 *  - {@link #clone()} returns a fresh instance with the same limits and reset
 *    state. Operations clone an application-supplied prototype, so concurrent
 *    operations never share counters or deadlines.
 *  - Not thread safe; one instance belongs to one operation.
 */
public interface RetryPolicy {

    /** Codes that signal a transient condition worth retrying. Read-only. */
    Set<Status.Code> RETRYABLE_CODES =
            Collections.unmodifiableSet(EnumSet.of(Status.Code.UNAVAILABLE, Status.Code.DEADLINE_EXCEEDED));

    /**
     * Record the failure of the attempt that just completed.
     *
     * @return true if another attempt is allowed
     */
    boolean onFailure(Status status);

    /** Fresh copy with the same configuration and reset state. */
    RetryPolicy clone();

    /** Shared retryability predicate: only transient transport codes are retryable. */
    static boolean isRetryable(Status status) {
        return RETRYABLE_CODES.contains(status.getCode());
    }
}
