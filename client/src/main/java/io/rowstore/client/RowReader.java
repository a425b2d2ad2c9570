// file: client/src/main/java/io/rowstore/client/RowReader.java
package io.rowstore.client;

import com.google.protobuf.ByteString;
import io.grpc.Deadline;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.rowstore.core.Filter;
import io.rowstore.core.Row;
import io.rowstore.core.RowKeyRange;
import io.rowstore.core.RowKeySet;
import io.rowstore.core.RowStoreException;
import io.rowstore.core.retry.BackoffPolicy;
import io.rowstore.core.retry.RetryPolicy;
import io.rowstore.proto.RowStoreProto;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Iterates the rows of a read, resuming the stream after transient failures.
 * <p>
 * Behaviour:
 *  - Only committed rows are returned; a row cut off by a failure is dropped.
 *  - After a stream error or a malformed stream the retry policy decides.
 *    A retry waits for the backoff delay (never past a time-limited policy's
 *    deadline), then asks only for rows after the last one returned, with the
 *    rows limit reduced by the rows already returned.
 *  - Nothing is retried once the remaining row set is empty or the limit is reached.
 *  - A failure that is not retried is thrown as {@link RowStoreException}
 *    from {@link #hasNext()} / {@link #next()}.
 *  - {@link #cancel()} ends the in-flight call and the iteration.
 * <p>
 * Not thread safe, except that {@link #cancel()} may be called from another thread.
 */
public final class RowReader implements Iterator<Row>, Iterable<Row>, AutoCloseable {

    private static final String RPC = "ReadRows";

    private final DataClient client;
    private final String tableName;
    private final RowKeySet rowSet;
    private final long rowsLimit;
    private final Filter filter;
    private final RetryPolicy retryPolicy;
    private final BackoffPolicy backoffPolicy;
    private final Supplier<Deadline> deadlines;

    private volatile DataClient.ServerStream<RowStoreProto.ReadRowsResponse> stream;
    private volatile boolean cancelled;
    private final Deque<RowStoreProto.ReadRowsResponse.CellChunk> chunks = new ArrayDeque<>();
    private ReadRowsParser parser;

    private ByteString lastReadKey;
    private long rowsRead;
    private Row nextRow;
    private boolean done;
    private int attempts;
    private long attemptStartNanos;

    /**
     * @param rowsLimit maximum number of rows to return, 0 for no limit
     * @param deadlines supplies the deadline of each attempt, may return null
     */
    public RowReader(
            DataClient client,
            String tableName,
            RowKeySet rowSet,
            long rowsLimit,
            Filter filter,
            RetryPolicy retryPolicy,
            BackoffPolicy backoffPolicy,
            Supplier<Deadline> deadlines
    ) {
        if (rowsLimit < 0) {
            throw new IllegalArgumentException("rowsLimit must be >= 0");
        }
        this.client = Objects.requireNonNull(client, "client");
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.rowSet = Objects.requireNonNull(rowSet, "rowSet").copy();
        this.rowsLimit = rowsLimit;
        this.filter = Objects.requireNonNull(filter, "filter");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        this.deadlines = Objects.requireNonNull(deadlines, "deadlines");
    }

    @Override
    public Iterator<Row> iterator() {
        return this;
    }

    @Override
    public boolean hasNext() {
        if (nextRow != null) {
            return true;
        }
        if (done) {
            return false;
        }
        nextRow = advance();
        return nextRow != null;
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Row r = nextRow;
        nextRow = null;
        return r;
    }

    /** Stop reading. Rows not yet returned are discarded. */
    public void cancel() {
        cancelled = true;
        var s = stream;
        if (s != null) {
            s.cancel();
        }
    }

    @Override
    public void close() {
        cancel();
    }

    /** Rows returned so far. */
    public long rowsRead() {
        return rowsRead;
    }

    public int attempts() {
        return attempts;
    }

    // ---------- internals ----------

    private Row advance() {
        while (true) {
            if (cancelled) {
                finish();
                return null;
            }
            Status failure;
            try {
                if (stream == null && !startStream()) {
                    finish();
                    return null;
                }
                Row row = readOneRow();
                if (row == null) {
                    logAttempt(Status.OK);
                    finish();
                    return null;
                }
                lastReadKey = row.rowKey();
                rowsRead++;
                return row;
            } catch (StatusRuntimeException e) {
                failure = e.getStatus();
            } catch (RowStoreException e) {
                failure = e.status();
            }

            if (cancelled) {
                finish();
                return null;
            }
            logAttempt(failure);
            var failed = stream;
            stream = null;
            if (failed != null) {
                failed.cancel();
            }

            if (!retryPolicy.onFailure(failure) || !pause(failure)) {
                RpcLogger.logGiveUp(RPC, tableName, attempts, failure);
                finish();
                throw new RowStoreException(failure);
            }
        }
    }

    /** Open the next attempt; false when there is nothing left to read. */
    private boolean startStream() {
        if (lastReadKey != null) {
            rowSet.intersect(RowKeyRange.after(lastReadKey));
        }
        if (rowsLimit > 0 && rowsRead >= rowsLimit) {
            return false;
        }
        if (rowSet.isEmpty()) {
            return false;
        }

        var request = RowStoreProto.ReadRowsRequest.newBuilder()
                .setTableName(tableName)
                .setRows(rowSet.toProto())
                .setFilter(filter.toProto());
        if (rowsLimit > 0) {
            request.setRowsLimit(rowsLimit - rowsRead);
        }

        parser = new ReadRowsParser();
        chunks.clear();
        attempts++;
        attemptStartNanos = System.nanoTime();
        stream = client.readRows(request.build(), deadlines.get());
        return true;
    }

    /** The next committed row of the current stream, or null at its clean end. */
    private Row readOneRow() {
        while (!parser.hasNext()) {
            if (chunks.isEmpty()) {
                if (!stream.hasNext()) {
                    parser.handleEndOfStream();
                    return null;
                }
                chunks.addAll(stream.next().getChunksList());
                continue;
            }
            parser.handleChunk(chunks.pollFirst());
        }
        return parser.next();
    }

    private void finish() {
        done = true;
        var s = stream;
        stream = null;
        if (s != null) {
            s.cancel();
        }
        chunks.clear();
    }

    private void logAttempt(Status status) {
        long millis = (System.nanoTime() - attemptStartNanos) / 1_000_000;
        RpcLogger.logAttempt(RPC, tableName, attempts, status, millis, "rows=" + rowsRead);
    }

    private boolean pause(Status failure) {
        try {
            return RetryPause.await(retryPolicy, backoffPolicy.onCompletion(failure));
        } catch (RowStoreException e) {
            finish();
            throw e;
        }
    }
}
