// file: client/src/main/java/io/rowstore/client/Table.java
package io.rowstore.client;

import com.google.protobuf.ByteString;
import io.grpc.Deadline;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.rowstore.core.BulkMutation;
import io.rowstore.core.ConditionalRowMutation;
import io.rowstore.core.FailedMutation;
import io.rowstore.core.Filter;
import io.rowstore.core.Row;
import io.rowstore.core.RowKeySample;
import io.rowstore.core.RowKeySet;
import io.rowstore.core.RowKeys;
import io.rowstore.core.RowStoreException;
import io.rowstore.core.SingleRowMutation;
import io.rowstore.core.retry.BackoffPolicy;
import io.rowstore.core.retry.LimitedTimeRetryPolicy;
import io.rowstore.core.retry.RetryPolicy;
import io.rowstore.proto.RowStoreProto;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for reading and writing one table.
 * <p>
 * Responsibilities:
 *  - Clone the configured policies for every operation, so concurrent
 *    operations never share retry state.
 *  - Retry single-row writes only when every mutation is idempotent.
 *  - Run bulk writes through a {@link BulkMutator} until nothing is pending
 *    or the retry policy gives up.
 *  - Run check-and-mutate, retried only when the idempotency policy allows it.
 *  - Hand out {@link RowReader}s for scans and point reads.
 *  - Sample row keys, starting over from scratch after every failed attempt.
 * <p>
 * Thread safe: the DataClient is shared, all other state is per operation.
 * The DataClient is borrowed and never closed here.
 */
public final class Table {

    private final DataClient client;
    private final String tableName;
    private final ClientOptions options;

    public Table(DataClient client, String tableName) {
        this(client, tableName, ClientOptions.defaults());
    }

    public Table(DataClient client, String tableName, ClientOptions options) {
        this.client = Objects.requireNonNull(client, "client");
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.options = Objects.requireNonNull(options, "options");
        if (tableName.isBlank()) {
            throw new IllegalArgumentException("tableName must not be blank");
        }
    }

    public String tableName() {
        return tableName;
    }

    public ClientOptions options() {
        return options;
    }

    // ---------- writes ----------

    /**
     * Atomically apply the mutations of one row.
     *
     * @throws RowStoreException with the last status when the write failed for good
     */
    public void apply(SingleRowMutation mutation) {
        Objects.requireNonNull(mutation, "mutation");
        RetryPolicy retry = options.retryPolicy().clone();
        BackoffPolicy backoff = options.backoffPolicy().clone();
        boolean idempotent = options.idempotentPolicy().clone().isIdempotent(mutation);

        var request = RowStoreProto.MutateRowRequest.newBuilder()
                .setTableName(tableName)
                .setRowKey(mutation.rowKey())
                .addAllMutations(mutation.mutationProtos())
                .build();

        for (int attempt = 1; ; attempt++) {
            long start = System.nanoTime();
            try {
                client.mutateRow(request, attemptDeadline(retry));
                RpcLogger.logAttempt("MutateRow", tableName, attempt, Status.OK, elapsedMillis(start), null);
                return;
            } catch (StatusRuntimeException e) {
                Status status = e.getStatus();
                RpcLogger.logAttempt("MutateRow", tableName, attempt, status, elapsedMillis(start),
                        idempotent ? null : "not idempotent");
                if (!idempotent
                        || !retry.onFailure(status)
                        || !RetryPause.await(retry, backoff.onCompletion(status))) {
                    RpcLogger.logGiveUp("MutateRow", tableName, attempt, status);
                    throw new RowStoreException(status, e);
                }
            }
        }
    }

    /**
     * Apply many single-row mutations. Entries succeed or fail independently.
     * Expected failures are reported, not thrown.
     *
     * @return the entries that were not applied, ordered by their index in {@code mutation}
     */
    public List<FailedMutation> bulkApply(BulkMutation mutation) {
        Objects.requireNonNull(mutation, "mutation");
        RetryPolicy retry = options.retryPolicy().clone();
        BackoffPolicy backoff = options.backoffPolicy().clone();
        var mutator = new BulkMutator(tableName, options.idempotentPolicy().clone(), mutation);

        while (mutator.hasPendingMutations()) {
            Status status = mutator.makeOneRequest(client, attemptDeadline(retry));
            if (!mutator.hasPendingMutations()) {
                break;
            }
            Status reason = status.isOk()
                    ? Status.UNAVAILABLE.withDescription("partial failure")
                    : status;
            if (!retry.onFailure(reason) || !RetryPause.await(retry, backoff.onCompletion(reason))) {
                RpcLogger.logGiveUp("MutateRows", tableName, mutator.attempts(), reason);
                break;
            }
        }
        return mutator.extractFinalFailures();
    }

    /**
     * Apply {@code mutation.ifMatched()} when its predicate yields any cell of
     * the row, {@code mutation.otherwise()} when it yields none. Not retried
     * under the default idempotency policy: a lost response leaves the outcome unknown.
     *
     * @return whether the predicate matched
     * @throws RowStoreException with the last status when the call failed for good
     */
    public boolean checkAndMutateRow(ConditionalRowMutation mutation) {
        Objects.requireNonNull(mutation, "mutation");
        RetryPolicy retry = options.retryPolicy().clone();
        BackoffPolicy backoff = options.backoffPolicy().clone();
        boolean idempotent = options.idempotentPolicy().clone().isIdempotent(mutation);
        var request = mutation.toRequest(tableName);

        for (int attempt = 1; ; attempt++) {
            long start = System.nanoTime();
            try {
                boolean matched = client.checkAndMutateRow(request, attemptDeadline(retry)).getPredicateMatched();
                RpcLogger.logAttempt("CheckAndMutateRow", tableName, attempt, Status.OK, elapsedMillis(start),
                        "matched=" + matched);
                return matched;
            } catch (StatusRuntimeException e) {
                Status status = e.getStatus();
                RpcLogger.logAttempt("CheckAndMutateRow", tableName, attempt, status, elapsedMillis(start),
                        idempotent ? null : "not idempotent");
                if (!idempotent
                        || !retry.onFailure(status)
                        || !RetryPause.await(retry, backoff.onCompletion(status))) {
                    RpcLogger.logGiveUp("CheckAndMutateRow", tableName, attempt, status);
                    throw new RowStoreException(status, e);
                }
            }
        }
    }

    // ---------- reads ----------

    public RowReader readRows(RowKeySet rows, Filter filter) {
        return readRows(rows, 0, filter);
    }

    /**
     * Read the rows of {@code rows} in key order.
     *
     * @param rowsLimit maximum number of rows, 0 for no limit
     */
    public RowReader readRows(RowKeySet rows, long rowsLimit, Filter filter) {
        RetryPolicy retry = options.retryPolicy().clone();
        return new RowReader(
                client,
                tableName,
                rows,
                rowsLimit,
                filter,
                retry,
                options.backoffPolicy().clone(),
                () -> attemptDeadline(retry));
    }

    /**
     * Read a single row.
     *
     * @return the row, or empty when it does not exist or the filter removed all its cells
     */
    public Optional<Row> readRow(ByteString rowKey, Filter filter) {
        try (RowReader reader = readRows(RowKeySet.of(rowKey), 1, filter)) {
            if (!reader.hasNext()) {
                return Optional.empty();
            }
            Row row = reader.next();
            if (reader.hasNext()) {
                throw new RowStoreException(Status.INTERNAL.withDescription(
                        "readRow(" + RowKeys.debugString(rowKey) + ") returned more than one row"));
            }
            return Optional.of(row);
        }
    }

    public Optional<Row> readRow(String rowKey, Filter filter) {
        return readRow(RowKeys.of(rowKey), filter);
    }

    /**
     * Split points of the table, in key order, each with the approximate bytes
     * stored before it. The last sample has an empty key and the table size.
     * Samples of a failed attempt are discarded before the next one.
     *
     * @throws RowStoreException with the last status when sampling failed for good
     */
    public List<RowKeySample> sampleRowKeys() {
        RetryPolicy retry = options.retryPolicy().clone();
        BackoffPolicy backoff = options.backoffPolicy().clone();
        var request = RowStoreProto.SampleRowKeysRequest.newBuilder().setTableName(tableName).build();
        List<RowKeySample> samples = new ArrayList<>();

        for (int attempt = 1; ; attempt++) {
            long start = System.nanoTime();
            DataClient.ServerStream<RowStoreProto.SampleRowKeysResponse> stream = null;
            try {
                stream = client.sampleRowKeys(request, attemptDeadline(retry));
                while (stream.hasNext()) {
                    var r = stream.next();
                    samples.add(new RowKeySample(r.getRowKey(), r.getOffsetBytes()));
                }
                RpcLogger.logAttempt("SampleRowKeys", tableName, attempt, Status.OK, elapsedMillis(start),
                        "samples=" + samples.size());
                return List.copyOf(samples);
            } catch (StatusRuntimeException e) {
                Status status = e.getStatus();
                RpcLogger.logAttempt("SampleRowKeys", tableName, attempt, status, elapsedMillis(start),
                        "discarding " + samples.size() + " sample(s)");
                samples.clear();
                if (stream != null) {
                    stream.cancel();
                }
                if (!retry.onFailure(status) || !RetryPause.await(retry, backoff.onCompletion(status))) {
                    RpcLogger.logGiveUp("SampleRowKeys", tableName, attempt, status);
                    throw new RowStoreException(status, e);
                }
            }
        }
    }

    // ---------- helpers ----------

    /** Per-attempt deadline, never past the deadline of a time-limited retry policy. */
    private Deadline attemptDeadline(RetryPolicy retry) {
        Duration timeout = options.attemptTimeout();
        if (retry instanceof LimitedTimeRetryPolicy limited) {
            Duration left = limited.remaining();
            if (left.compareTo(timeout) < 0) {
                timeout = left;
            }
        }
        return Deadline.after(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
