// file: emulator/src/main/java/io/rowstore/emulator/FaultInjector.java
package io.rowstore.emulator;

import com.google.protobuf.ByteString;
import io.grpc.Status;
import io.rowstore.core.RowKeys;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Scripted failures for exercising client retries against the emulator.
 * <p>
 * Supported faults:
 *  - Reject the next N mutations of a row key with a status (MutateRow and
 *    each MutateRows entry count as one).
 *  - Apply the next MutateRows call but end its stream with a status before
 *    any entry status is sent.
 *  - Break the next ReadRows stream after K committed rows. When a further row
 *    exists, its first chunk is sent uncommitted before the error.
 *  - Break the next SampleRowKeys stream after its first sample.
 * <p>
 * Faults are consumed in the order they were scripted. Thread safe.
 */
public final class FaultInjector {
    private static final Logger log = Logger.getLogger(FaultInjector.class.getName());

    /** A scripted ReadRows interruption. */
    public record ReadBreak(int afterRows, Status status) {
        public ReadBreak {
            if (afterRows < 0) {
                throw new IllegalArgumentException("afterRows must be >= 0");
            }
            Objects.requireNonNull(status, "status");
        }
    }

    private record RowFailure(Status status, int remaining) {}

    private final Map<ByteString, RowFailure> rowFailures = new HashMap<>();
    private final Deque<Status> mutateRowsAborts = new ArrayDeque<>();
    private final Deque<ReadBreak> readBreaks = new ArrayDeque<>();
    private final Deque<Status> sampleBreaks = new ArrayDeque<>();

    public synchronized void failNextMutations(ByteString rowKey, int times, Status status) {
        Objects.requireNonNull(rowKey, "rowKey");
        Objects.requireNonNull(status, "status");
        if (times <= 0) {
            throw new IllegalArgumentException("times must be > 0");
        }
        rowFailures.put(rowKey, new RowFailure(status, times));
    }

    public void failNextMutations(String rowKey, int times, Status status) {
        failNextMutations(RowKeys.of(rowKey), times, status);
    }

    public synchronized void abortNextMutateRows(Status status) {
        mutateRowsAborts.addLast(Objects.requireNonNull(status, "status"));
    }

    public synchronized void breakNextReadRows(int afterRows, Status status) {
        readBreaks.addLast(new ReadBreak(afterRows, status));
    }

    public synchronized void breakNextSampleRowKeys(Status status) {
        sampleBreaks.addLast(Objects.requireNonNull(status, "status"));
    }

    public synchronized void clear() {
        rowFailures.clear();
        mutateRowsAborts.clear();
        readBreaks.clear();
        sampleBreaks.clear();
    }

    // ---------- consumed by RowStoreService ----------

    synchronized Optional<Status> takeMutationFailure(ByteString rowKey) {
        RowFailure f = rowFailures.get(rowKey);
        if (f == null) {
            return Optional.empty();
        }
        if (f.remaining() <= 1) {
            rowFailures.remove(rowKey);
        } else {
            rowFailures.put(rowKey, new RowFailure(f.status(), f.remaining() - 1));
        }
        log.fine(() -> "injecting " + f.status().getCode() + " for row " + RowKeys.debugString(rowKey));
        return Optional.of(f.status());
    }

    synchronized Optional<Status> takeMutateRowsAbort() {
        return Optional.ofNullable(mutateRowsAborts.pollFirst());
    }

    synchronized Optional<ReadBreak> takeReadBreak() {
        return Optional.ofNullable(readBreaks.pollFirst());
    }

    synchronized Optional<Status> takeSampleBreak() {
        return Optional.ofNullable(sampleBreaks.pollFirst());
    }
}
