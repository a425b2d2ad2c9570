// file: core/src/main/java/io/rowstore/core/retry/BackoffPolicy.java
package io.rowstore.core.retry;

import io.grpc.Status;

import java.time.Duration;

/**
 * Decides how long to wait before the next attempt.
 * <p>
 * Independent of the retry decision: callers may invoke it after a success as
 * well as after a failure, and decide themselves whether to honour the delay.
 * Same clone-per-operation contract as {@link RetryPolicy}.
 */
public interface BackoffPolicy {

    Duration onCompletion(Status status);

    BackoffPolicy clone();
}
