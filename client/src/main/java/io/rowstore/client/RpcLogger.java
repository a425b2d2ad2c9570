// file: client/src/main/java/io/rowstore/client/RpcLogger.java
package io.rowstore.client;

import io.grpc.Status;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for per-attempt RPC logging.
 *
 * Responsibilities:
 *  - One line per attempt: rpc, table, attempt number, status and latency.
 *  - Successful attempts at FINE, failed ones at WARNING.
 *  - One WARNING line when an operation gives up.
 */
public final class RpcLogger {
    private static final Logger log = Logger.getLogger(RpcLogger.class.getName());

    private RpcLogger() {
        // utility
    }

    /**
     * Log a completed attempt.
     *
     * @param rpc         RPC name (MutateRow, MutateRows, ReadRows)
     * @param table       table name
     * @param attempt     1-based attempt number within the operation
     * @param status      attempt outcome
     * @param totalMillis wall-clock latency of the attempt
     * @param detail      optional extra text, null if none
     */
    public static void logAttempt(
            String rpc,
            String table,
            int attempt,
            Status status,
            long totalMillis,
            String detail
    ) {
        if (status.isOk() && !log.isLoggable(Level.FINE)) {
            return;
        }
        String msg = String.format(
                "RPC %s %s attempt=%d -> %s (total=%dms%s)",
                rpc,
                table,
                attempt,
                describe(status),
                totalMillis,
                detail != null ? ", " + detail : ""
        );
        log.log(status.isOk() ? Level.FINE : Level.WARNING, msg);
    }

    /** Log that an operation stopped retrying. */
    public static void logGiveUp(String rpc, String table, int attempts, Status lastStatus) {
        log.log(Level.WARNING, String.format(
                "RPC %s %s giving up after %d attempt(s), last status %s",
                rpc, table, attempts, describe(lastStatus)));
    }

    private static String describe(Status status) {
        return status.getDescription() == null
                ? status.getCode().name()
                : status.getCode() + " " + status.getDescription();
    }
}
