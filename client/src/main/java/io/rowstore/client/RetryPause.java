// file: client/src/main/java/io/rowstore/client/RetryPause.java
package io.rowstore.client;

import io.grpc.Status;
import io.rowstore.core.RowStoreException;
import io.rowstore.core.retry.LimitedTimeRetryPolicy;
import io.rowstore.core.retry.RetryPolicy;

import java.time.Duration;

/**
 * The pause between two attempts of one operation.
 * <p>
 * Under a {@link LimitedTimeRetryPolicy} a pause never runs into the policy's
 * deadline: when the next attempt could not start before it, the operation
 * stops at once instead of sleeping.
 */
final class RetryPause {

    private RetryPause() {
    }

    /**
     * Sleep for {@code delay} unless the retry budget runs out first.
     *
     * @return true after sleeping; false, without sleeping, when no attempt fits in the budget
     * @throws RowStoreException with CANCELLED when the thread is interrupted
     */
    static boolean await(RetryPolicy retry, Duration delay) {
        if (retry instanceof LimitedTimeRetryPolicy limited
                && delay.compareTo(limited.remaining()) >= 0) {
            return false;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RowStoreException(Status.CANCELLED.withDescription("interrupted while backing off"), e);
        }
    }
}
