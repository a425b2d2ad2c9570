// file: emulator/src/main/java/io/rowstore/emulator/RowStoreService.java
package io.rowstore.emulator;

import com.google.protobuf.ByteString;
import com.google.protobuf.BytesValue;
import com.google.protobuf.StringValue;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import io.rowstore.core.Cell;
import io.rowstore.core.Mutation;
import io.rowstore.core.Row;
import io.rowstore.core.RowKeySample;
import io.rowstore.core.RowKeySet;
import io.rowstore.proto.RowStoreGrpc;
import io.rowstore.proto.RowStoreProto;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * gRPC implementation of the RowStore data API over {@link InMemoryTable}s.
 * <p>
 * Responsibilities:
 *  - Decode requests into table calls; tables are created on first use.
 *  - MutateRows: apply every entry independently and stream one response
 *    holding a status per request index.
 *  - ReadRows: one response per row, values longer than {@code chunkSize}
 *    split across chunks that carry the full value size.
 *  - CheckAndMutateRow: evaluate the predicate and apply one branch atomically.
 *  - SampleRowKeys: one response per sample, about {@code sampleIntervalBytes} apart.
 *  - Consult the {@link FaultInjector} before touching a table.
 *  - Map IllegalArgumentException to INVALID_ARGUMENT, everything else to INTERNAL.
 */
public final class RowStoreService extends RowStoreGrpc.RowStoreImplBase {
    private static final Logger log = Logger.getLogger(RowStoreService.class.getName());

    private final Map<String, InMemoryTable> tables = new ConcurrentHashMap<>();
    private final FaultInjector faults;
    private final int chunkSize;
    private final long sampleIntervalBytes;

    public static final long DEFAULT_SAMPLE_INTERVAL_BYTES = 1024 * 1024;

    public RowStoreService(int chunkSize) {
        this(chunkSize, new FaultInjector());
    }

    public RowStoreService(int chunkSize, FaultInjector faults) {
        this(chunkSize, DEFAULT_SAMPLE_INTERVAL_BYTES, faults);
    }

    public RowStoreService(int chunkSize, long sampleIntervalBytes, FaultInjector faults) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (sampleIntervalBytes <= 0) {
            throw new IllegalArgumentException("sampleIntervalBytes must be > 0");
        }
        this.chunkSize = chunkSize;
        this.sampleIntervalBytes = sampleIntervalBytes;
        this.faults = Objects.requireNonNull(faults, "faults");
    }

    public FaultInjector faults() {
        return faults;
    }

    /** The named table, created empty if it does not exist yet. */
    public InMemoryTable table(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("table name must not be empty");
        }
        return tables.computeIfAbsent(tableName, InMemoryTable::new);
    }

    @Override
    public void mutateRow(
            RowStoreProto.MutateRowRequest request,
            StreamObserver<RowStoreProto.MutateRowResponse> responseObserver
    ) {
        try {
            InMemoryTable table = table(request.getTableName());
            Optional<Status> injected = faults.takeMutationFailure(request.getRowKey());
            if (injected.isPresent()) {
                responseObserver.onError(injected.get().asException());
                return;
            }
            table.apply(request.getRowKey(), decode(request.getMutationsList()));

            responseObserver.onNext(RowStoreProto.MutateRowResponse.getDefaultInstance());
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(
                    Status.INVALID_ARGUMENT
                            .withDescription(iae.getMessage())
                            .asException()
            );
        } catch (Exception e) {
            log.log(Level.WARNING, "MutateRow failed", e);
            responseObserver.onError(
                    Status.INTERNAL
                            .withDescription(e.getMessage())
                            .asException()
            );
        }
    }

    @Override
    public void mutateRows(
            RowStoreProto.MutateRowsRequest request,
            StreamObserver<RowStoreProto.MutateRowsResponse> responseObserver
    ) {
        try {
            InMemoryTable table = table(request.getTableName());
            Optional<Status> abort = faults.takeMutateRowsAbort();

            var response = RowStoreProto.MutateRowsResponse.newBuilder();
            for (int i = 0; i < request.getEntriesCount(); i++) {
                Status s = applyEntry(table, request.getEntries(i));
                response.addEntries(RowStoreProto.MutateRowsResponse.Entry.newBuilder()
                        .setIndex(i)
                        .setStatus(toEntryStatus(s)));
            }

            if (abort.isPresent()) {
                log.fine(() -> "aborting MutateRows stream with " + abort.get().getCode());
                responseObserver.onError(abort.get().asException());
                return;
            }
            responseObserver.onNext(response.build());
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(
                    Status.INVALID_ARGUMENT
                            .withDescription(iae.getMessage())
                            .asException()
            );
        } catch (Exception e) {
            log.log(Level.WARNING, "MutateRows failed", e);
            responseObserver.onError(
                    Status.INTERNAL
                            .withDescription(e.getMessage())
                            .asException()
            );
        }
    }

    private Status applyEntry(InMemoryTable table, RowStoreProto.MutateRowsRequest.Entry entry) {
        Optional<Status> injected = faults.takeMutationFailure(entry.getRowKey());
        if (injected.isPresent()) {
            return injected.get();
        }
        try {
            table.apply(entry.getRowKey(), decode(entry.getMutationsList()));
            return Status.OK;
        } catch (IllegalArgumentException iae) {
            return Status.INVALID_ARGUMENT.withDescription(iae.getMessage());
        }
    }

    @Override
    public void readRows(
            RowStoreProto.ReadRowsRequest request,
            StreamObserver<RowStoreProto.ReadRowsResponse> responseObserver
    ) {
        try {
            if (request.getRowsLimit() < 0) {
                throw new IllegalArgumentException("rows_limit must be >= 0");
            }
            InMemoryTable table = table(request.getTableName());
            List<Row> rows = table.read(
                    RowKeySet.fromProto(request.getRows()),
                    request.getFilter(),
                    request.getRowsLimit());
            Optional<FaultInjector.ReadBreak> brk = faults.takeReadBreak();

            int sent = 0;
            for (Row row : rows) {
                List<RowStoreProto.ReadRowsResponse.CellChunk> chunks = toChunks(row, chunkSize);
                if (brk.isPresent() && sent == brk.get().afterRows()) {
                    // leave the client holding a partial row
                    responseObserver.onNext(RowStoreProto.ReadRowsResponse.newBuilder()
                            .addChunks(chunks.get(0).toBuilder().clearRowStatus())
                            .build());
                    break;
                }
                responseObserver.onNext(RowStoreProto.ReadRowsResponse.newBuilder()
                        .addAllChunks(chunks)
                        .build());
                sent++;
            }

            if (brk.isPresent()) {
                int delivered = sent;
                log.fine(() -> "breaking ReadRows stream after " + delivered + " row(s)");
                responseObserver.onError(brk.get().status().asException());
                return;
            }
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(
                    Status.INVALID_ARGUMENT
                            .withDescription(iae.getMessage())
                            .asException()
            );
        } catch (Exception e) {
            log.log(Level.WARNING, "ReadRows failed", e);
            responseObserver.onError(
                    Status.INTERNAL
                            .withDescription(e.getMessage())
                            .asException()
            );
        }
    }

    @Override
    public void checkAndMutateRow(
            RowStoreProto.CheckAndMutateRowRequest request,
            StreamObserver<RowStoreProto.CheckAndMutateRowResponse> responseObserver
    ) {
        try {
            InMemoryTable table = table(request.getTableName());
            Optional<Status> injected = faults.takeMutationFailure(request.getRowKey());
            if (injected.isPresent()) {
                responseObserver.onError(injected.get().asException());
                return;
            }
            boolean matched = table.checkAndMutate(
                    request.getRowKey(),
                    request.getPredicateFilter(),
                    decode(request.getTrueMutationsList()),
                    decode(request.getFalseMutationsList()));

            responseObserver.onNext(RowStoreProto.CheckAndMutateRowResponse.newBuilder()
                    .setPredicateMatched(matched)
                    .build());
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(
                    Status.INVALID_ARGUMENT
                            .withDescription(iae.getMessage())
                            .asException()
            );
        } catch (Exception e) {
            log.log(Level.WARNING, "CheckAndMutateRow failed", e);
            responseObserver.onError(
                    Status.INTERNAL
                            .withDescription(e.getMessage())
                            .asException()
            );
        }
    }

    @Override
    public void sampleRowKeys(
            RowStoreProto.SampleRowKeysRequest request,
            StreamObserver<RowStoreProto.SampleRowKeysResponse> responseObserver
    ) {
        try {
            InMemoryTable table = table(request.getTableName());
            List<RowKeySample> samples = table.sampleRowKeys(sampleIntervalBytes);
            Optional<Status> brk = faults.takeSampleBreak();

            for (RowKeySample sample : samples) {
                responseObserver.onNext(RowStoreProto.SampleRowKeysResponse.newBuilder()
                        .setRowKey(sample.rowKey())
                        .setOffsetBytes(sample.offsetBytes())
                        .build());
                if (brk.isPresent()) {
                    log.fine(() -> "breaking SampleRowKeys stream with " + brk.get().getCode());
                    responseObserver.onError(brk.get().asException());
                    return;
                }
            }
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(
                    Status.INVALID_ARGUMENT
                            .withDescription(iae.getMessage())
                            .asException()
            );
        } catch (Exception e) {
            log.log(Level.WARNING, "SampleRowKeys failed", e);
            responseObserver.onError(
                    Status.INTERNAL
                            .withDescription(e.getMessage())
                            .asException()
            );
        }
    }

    // ---------- encoding helpers ----------

    private static List<Mutation> decode(List<RowStoreProto.Mutation> protos) {
        List<Mutation> out = new ArrayList<>(protos.size());
        for (var p : protos) {
            out.add(Mutation.fromProto(p));
        }
        return out;
    }

    static RowStoreProto.EntryStatus toEntryStatus(Status s) {
        var b = RowStoreProto.EntryStatus.newBuilder().setCode(s.getCode().value());
        if (s.getDescription() != null) {
            b.setMessage(s.getDescription());
        }
        return b.build();
    }

    /**
     * Chunks of one row. The first chunk carries the row key, each cell's first
     * chunk its family, qualifier and timestamp, the last chunk commits the row.
     */
    static List<RowStoreProto.ReadRowsResponse.CellChunk> toChunks(Row row, int chunkSize) {
        List<RowStoreProto.ReadRowsResponse.CellChunk> chunks = new ArrayList<>();
        List<Cell> cells = row.cells();
        for (int i = 0; i < cells.size(); i++) {
            Cell cell = cells.get(i);
            ByteString value = cell.value();
            int pieces = Math.max(1, (value.size() + chunkSize - 1) / chunkSize);

            for (int p = 0; p < pieces; p++) {
                var b = RowStoreProto.ReadRowsResponse.CellChunk.newBuilder();
                if (p == 0) {
                    if (i == 0) {
                        b.setRowKey(row.rowKey());
                    }
                    b.setFamilyName(StringValue.of(cell.family()))
                            .setQualifier(BytesValue.of(cell.qualifier()))
                            .setTimestampMicros(cell.timestampMicros())
                            .addAllLabels(cell.labels());
                }
                int from = p * chunkSize;
                int to = Math.min(value.size(), from + chunkSize);
                b.setValue(value.substring(from, to));
                if (p < pieces - 1) {
                    b.setValueSize(value.size());
                }
                if (i == cells.size() - 1 && p == pieces - 1) {
                    b.setCommitRow(true);
                }
                chunks.add(b.build());
            }
        }
        return chunks;
    }

    @Override
    public String toString() {
        return "RowStoreService{tables=" + tables.keySet() + ", chunkSize=" + chunkSize + "}";
    }
}
