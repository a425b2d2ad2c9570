// file: client/src/main/java/io/rowstore/client/BulkMutator.java
package io.rowstore.client;

import io.grpc.Deadline;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.rowstore.core.BulkMutation;
import io.rowstore.core.FailedMutation;
import io.rowstore.core.SingleRowMutation;
import io.rowstore.core.retry.IdempotentMutationPolicy;
import io.rowstore.core.retry.RetryPolicy;
import io.rowstore.proto.RowStoreProto;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Drives one bulk mutation through as many MutateRows attempts as the caller allows.
 * <p>
 * Every entry is classified once, up front: it is idempotent when all of its
 * mutations are. After each attempt an entry is in exactly one state:
 *  - resolved: the server reported OK;
 *  - pending: it will be part of the next attempt;
 *  - failed: a terminal {@link FailedMutation} was recorded.
 * <p>
 * Per-entry outcome of an attempt:
 *  - OK                              -> resolved
 *  - retryable, idempotent           -> pending
 *  - retryable, not idempotent       -> failed (NOT_IDEMPOTENT)
 *  - not retryable                   -> failed (SERVER_REJECTED)
 *  - no status, idempotent           -> pending
 *  - no status, not idempotent       -> failed (UNCONFIRMED)
 * <p>
 * An out-of-range or repeated index in a response breaks the protocol: the
 * stream is abandoned and every entry of that attempt not yet resolved OK,
 * including those already requeued, fails with INTERNAL (cause UNCONFIRMED).
 * The retry decision itself belongs to the caller (see {@link Table#bulkApply}).
 * Not thread safe.
 */
public final class BulkMutator {
    private static final Logger log = Logger.getLogger(BulkMutator.class.getName());

    private static final String RPC = "MutateRows";

    private final String tableName;

    // indexed by original index
    private final SingleRowMutation[] entries;
    private final boolean[] idempotent;
    private final Status[] lastStatus;

    // original indices of the entries for the next attempt
    private int[] pending;
    private int pendingCount;

    private final List<FailedMutation> failures = new ArrayList<>();
    private int attempts;
    private boolean extracted;

    public BulkMutator(String tableName, IdempotentMutationPolicy policy, BulkMutation mutation) {
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(mutation, "mutation");

        int n = mutation.size();
        this.entries = new SingleRowMutation[n];
        this.idempotent = new boolean[n];
        this.lastStatus = new Status[n];
        this.pending = new int[n];
        for (int i = 0; i < n; i++) {
            entries[i] = mutation.get(i);
            idempotent[i] = policy.isIdempotent(entries[i]);
            pending[i] = i;
        }
        this.pendingCount = n;
    }

    public boolean hasPendingMutations() {
        return !extracted && pendingCount > 0;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Send every pending entry in one MutateRows call and sort the outcome.
     *
     * @return the stream-level status of the attempt; INTERNAL on a protocol violation
     */
    public Status makeOneRequest(DataClient client, Deadline deadline) {
        if (extracted) {
            throw new IllegalStateException("final failures were already extracted");
        }

        // attempt-local position -> original index, and whether a status arrived
        final int[] current = Arrays.copyOf(pending, pendingCount);
        final boolean[] answered = new boolean[current.length];
        pendingCount = 0;
        attempts++;

        var request = RowStoreProto.MutateRowsRequest.newBuilder().setTableName(tableName);
        for (int original : current) {
            request.addEntries(entries[original].toEntryProto());
        }

        long start = System.nanoTime();
        Status streamStatus = Status.OK;
        Status violation = null;
        DataClient.ServerStream<RowStoreProto.MutateRowsResponse> stream = null;
        try {
            stream = client.mutateRows(request.build(), deadline);
            outer:
            while (stream.hasNext()) {
                for (var e : stream.next().getEntriesList()) {
                    long index = e.getIndex();
                    if (index < 0 || index >= current.length || answered[(int) index]) {
                        violation = Status.INTERNAL.withDescription(
                                "MutateRows response has invalid index " + index
                                        + " for a request of " + current.length + " entries");
                        break outer;
                    }
                    answered[(int) index] = true;
                    onEntryStatus(current[(int) index], toStatus(e.getStatus()));
                }
            }
        } catch (StatusRuntimeException e) {
            streamStatus = e.getStatus();
        }

        if (violation != null) {
            stream.cancel();
            streamStatus = violation;
            // nothing in this response can be trusted, including the requeues
            for (int i = 0; i < pendingCount; i++) {
                fail(pending[i], violation, FailedMutation.Cause.UNCONFIRMED);
            }
            pendingCount = 0;
            for (int i = 0; i < current.length; i++) {
                if (!answered[i]) {
                    fail(current[i], violation, FailedMutation.Cause.UNCONFIRMED);
                }
            }
        } else {
            for (int i = 0; i < current.length; i++) {
                if (!answered[i]) {
                    onMissingStatus(current[i], streamStatus);
                }
            }
        }

        long millis = (System.nanoTime() - start) / 1_000_000;
        RpcLogger.logAttempt(RPC, tableName, attempts, streamStatus, millis,
                "entries=" + current.length + ", pending=" + pendingCount + ", failed=" + failures.size());
        return streamStatus;
    }

    private void onEntryStatus(int original, Status status) {
        lastStatus[original] = status;
        if (status.isOk()) {
            return;
        }
        if (!RetryPolicy.isRetryable(status)) {
            fail(original, status, FailedMutation.Cause.SERVER_REJECTED);
        } else if (idempotent[original]) {
            requeue(original);
        } else {
            fail(original, status, FailedMutation.Cause.NOT_IDEMPOTENT);
        }
    }

    private void onMissingStatus(int original, Status streamStatus) {
        if (idempotent[original]) {
            if (!streamStatus.isOk()) {
                lastStatus[original] = streamStatus;
            }
            requeue(original);
            return;
        }
        Status s = streamStatus.isOk()
                ? Status.INTERNAL.withDescription("no response received for entry")
                : streamStatus;
        fail(original, s, FailedMutation.Cause.UNCONFIRMED);
    }

    private void requeue(int original) {
        pending[pendingCount++] = original;
    }

    private void fail(int original, Status status, FailedMutation.Cause cause) {
        lastStatus[original] = status;
        failures.add(new FailedMutation(original, entries[original], status, cause));
    }

    /**
     * Close the books: every still-pending entry becomes a RETRY_BUDGET_EXHAUSTED
     * failure carrying the last status seen for it. May be called once.
     *
     * @return all failures, ordered by original index
     */
    public List<FailedMutation> extractFinalFailures() {
        if (extracted) {
            throw new IllegalStateException("final failures were already extracted");
        }
        extracted = true;

        for (int i = 0; i < pendingCount; i++) {
            int original = pending[i];
            Status last = lastStatus[original];
            Status s = last != null && !last.isOk()
                    ? last
                    : Status.UNAVAILABLE.withDescription("retry budget exhausted");
            failures.add(new FailedMutation(original, entries[original], s,
                    FailedMutation.Cause.RETRY_BUDGET_EXHAUSTED));
        }
        if (pendingCount > 0) {
            int exhausted = pendingCount;
            log.fine(() -> "table " + tableName + ": " + exhausted + " pending entries left after "
                    + attempts + " attempt(s)");
        }
        pendingCount = 0;

        failures.sort(Comparator.comparingInt(FailedMutation::originalIndex));
        return List.copyOf(failures);
    }

    static Status toStatus(RowStoreProto.EntryStatus proto) {
        Status s = Status.fromCodeValue(proto.getCode());
        return proto.getMessage().isEmpty() ? s : s.withDescription(proto.getMessage());
    }
}
