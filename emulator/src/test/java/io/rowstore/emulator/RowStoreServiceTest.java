// file: emulator/src/test/java/io/rowstore/emulator/RowStoreServiceTest.java
package io.rowstore.emulator;

import com.google.protobuf.ByteString;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.rowstore.core.Filter;
import io.rowstore.core.Mutation;
import io.rowstore.core.Row;
import io.rowstore.core.RowKeys;
import io.rowstore.core.SingleRowMutation;
import io.rowstore.proto.RowStoreGrpc;
import io.rowstore.proto.RowStoreProto;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for RowStoreService over an in-process channel:
 *  - MutateRows reports a status per request index.
 *  - ReadRows splits long values and commits every row.
 *  - CheckAndMutateRow reports whether the predicate matched.
 *  - SampleRowKeys streams split points and ends with the table size.
 *  - Scripted faults surface as gRPC errors.
 */
class RowStoreServiceTest {

    private RowStoreService service;
    private Server server;
    private ManagedChannel channel;
    private RowStoreGrpc.RowStoreBlockingStub stub;

    @BeforeEach
    void setUp() throws IOException {
        service = new RowStoreService(4, 20, new FaultInjector());
        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder
                .forName(name)
                .directExecutor()
                .addService(service)
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name)
                .directExecutor()
                .build();
        stub = RowStoreGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void tearDown() {
        channel.shutdownNow();
        server.shutdownNow();
    }

    private static RowStoreProto.MutateRowsRequest bulk(SingleRowMutation... entries) {
        var b = RowStoreProto.MutateRowsRequest.newBuilder().setTableName("t");
        for (var e : entries) {
            b.addEntries(e.toEntryProto());
        }
        return b.build();
    }

    private static List<RowStoreProto.ReadRowsResponse.CellChunk> drain(
            Iterator<RowStoreProto.ReadRowsResponse> it) {
        List<RowStoreProto.ReadRowsResponse.CellChunk> chunks = new ArrayList<>();
        it.forEachRemaining(r -> chunks.addAll(r.getChunksList()));
        return chunks;
    }

    @Test
    void mutate_row_applies_to_named_table() {
        stub.mutateRow(RowStoreProto.MutateRowRequest.newBuilder()
                .setTableName("t")
                .setRowKey(RowKeys.of("r1"))
                .addMutations(Mutation.setCell("fam", "c", 1, "v").toProto())
                .build());

        assertEquals(1, service.table("t").rowCount());
        assertEquals(0, service.table("other").rowCount());
    }

    @Test
    void mutate_row_without_table_name_is_invalid_argument() {
        var ex = assertThrows(StatusRuntimeException.class, () ->
                stub.mutateRow(RowStoreProto.MutateRowRequest.newBuilder()
                        .setRowKey(RowKeys.of("r1"))
                        .addMutations(Mutation.deleteFromRow().toProto())
                        .build()));
        assertEquals(Status.Code.INVALID_ARGUMENT, ex.getStatus().getCode());
    }

    @Test
    void mutate_rows_reports_each_index() {
        service.faults().failNextMutations("bad", 1, Status.PERMISSION_DENIED);

        var responses = stub.mutateRows(bulk(
                SingleRowMutation.of("ok", Mutation.setCell("fam", "c", 1, "v")),
                SingleRowMutation.of("bad", Mutation.setCell("fam", "c", 1, "v")),
                new SingleRowMutation(RowKeys.of("empty-mutation"),
                        List.of(Mutation.deleteFromRow()))));

        List<RowStoreProto.MutateRowsResponse.Entry> entries = new ArrayList<>();
        responses.forEachRemaining(r -> entries.addAll(r.getEntriesList()));

        assertEquals(3, entries.size());
        assertEquals(0, entries.get(0).getStatus().getCode());
        assertEquals(1, entries.get(1).getIndex());
        assertEquals(Status.Code.PERMISSION_DENIED.value(), entries.get(1).getStatus().getCode());
        assertEquals(0, entries.get(2).getStatus().getCode());
        assertEquals(1, service.table("t").rowCount());
    }

    @Test
    void aborted_mutate_rows_applies_but_sends_no_statuses() {
        service.faults().abortNextMutateRows(Status.UNAVAILABLE);

        var it = stub.mutateRows(bulk(SingleRowMutation.of("r", Mutation.setCell("fam", "c", 1, "v"))));
        var ex = assertThrows(StatusRuntimeException.class, it::hasNext);
        assertEquals(Status.Code.UNAVAILABLE, ex.getStatus().getCode());
        assertEquals(1, service.table("t").rowCount());
    }

    @Test
    void read_rows_splits_values_longer_than_chunk_size() {
        service.table("t").apply(RowKeys.of("r"), List.of(
                Mutation.setCell("fam", "c", 1, "0123456789"),
                Mutation.setCell("fam", "d", 1, "")));

        var chunks = drain(stub.readRows(RowStoreProto.ReadRowsRequest.newBuilder()
                .setTableName("t").build()));

        // "0123", "4567", "89" then the empty cell
        assertEquals(4, chunks.size());
        assertEquals(RowKeys.of("r"), chunks.get(0).getRowKey());
        assertEquals(10, chunks.get(0).getValueSize());
        assertEquals(10, chunks.get(1).getValueSize());
        assertEquals(0, chunks.get(2).getValueSize());
        assertFalse(chunks.get(1).hasFamilyName());
        assertEquals(RowKeys.of("d"), chunks.get(3).getQualifier().getValue());
        assertTrue(chunks.get(3).getCommitRow());
        assertEquals(ByteString.EMPTY, chunks.get(3).getRowKey());
    }

    @Test
    void chunks_reassemble_to_original_cells() {
        var row = new Row(RowKeys.of("r"), List.of(
                new io.rowstore.core.Cell(RowKeys.of("r"), "fam", RowKeys.of("q"), 7,
                        RowKeys.of("abcdefghij"), List.of("lbl"))));
        var chunks = RowStoreService.toChunks(row, 3);

        ByteString value = ByteString.EMPTY;
        for (var c : chunks) {
            value = value.concat(c.getValue());
        }
        assertEquals(4, chunks.size());
        assertEquals(RowKeys.of("abcdefghij"), value);
        assertEquals(List.of("lbl"), chunks.get(0).getLabelsList());
        assertEquals(7, chunks.get(0).getTimestampMicros());
    }

    @Test
    void broken_read_sends_committed_rows_then_a_partial_row_then_error() {
        var table = service.table("t");
        for (String k : List.of("a", "b", "c")) {
            table.apply(RowKeys.of(k), List.of(Mutation.setCell("fam", "c", 1, "v")));
        }
        service.faults().breakNextReadRows(1, Status.UNAVAILABLE);

        var it = stub.readRows(RowStoreProto.ReadRowsRequest.newBuilder().setTableName("t").build());
        List<RowStoreProto.ReadRowsResponse.CellChunk> chunks = new ArrayList<>();
        var ex = assertThrows(StatusRuntimeException.class,
                () -> it.forEachRemaining(r -> chunks.addAll(r.getChunksList())));

        assertEquals(Status.Code.UNAVAILABLE, ex.getStatus().getCode());
        assertEquals(2, chunks.size());
        assertTrue(chunks.get(0).getCommitRow());
        assertEquals(RowKeys.of("b"), chunks.get(1).getRowKey());
        assertFalse(chunks.get(1).getCommitRow());

        // the fault is consumed
        assertEquals(3, drain(stub.readRows(RowStoreProto.ReadRowsRequest.newBuilder()
                .setTableName("t").build())).size());
    }

    @Test
    void negative_rows_limit_is_invalid_argument() {
        var it = stub.readRows(RowStoreProto.ReadRowsRequest.newBuilder()
                .setTableName("t").setRowsLimit(-1).build());
        var ex = assertThrows(StatusRuntimeException.class, it::hasNext);
        assertEquals(Status.Code.INVALID_ARGUMENT, ex.getStatus().getCode());
    }

    private static RowStoreProto.CheckAndMutateRowRequest checkAndSet(String row) {
        return RowStoreProto.CheckAndMutateRowRequest.newBuilder()
                .setTableName("t")
                .setRowKey(RowKeys.of(row))
                .setPredicateFilter(Filter.column("lock").toProto())
                .addFalseMutations(Mutation.setCell("fam", "lock", 1, "mine").toProto())
                .build();
    }

    @Test
    void check_and_mutate_row_reports_the_predicate_outcome() {
        assertFalse(stub.checkAndMutateRow(checkAndSet("r")).getPredicateMatched());
        assertTrue(stub.checkAndMutateRow(checkAndSet("r")).getPredicateMatched());
        assertEquals(1, service.table("t").rowCount());
    }

    @Test
    void check_and_mutate_row_without_mutations_is_invalid_argument() {
        var ex = assertThrows(StatusRuntimeException.class, () ->
                stub.checkAndMutateRow(checkAndSet("r").toBuilder().clearFalseMutations().build()));
        assertEquals(Status.Code.INVALID_ARGUMENT, ex.getStatus().getCode());
    }

    @Test
    void check_and_mutate_row_consults_row_faults() {
        service.faults().failNextMutations("r", 1, Status.UNAVAILABLE);

        var ex = assertThrows(StatusRuntimeException.class, () -> stub.checkAndMutateRow(checkAndSet("r")));
        assertEquals(Status.Code.UNAVAILABLE, ex.getStatus().getCode());
        assertEquals(0, service.table("t").rowCount());
    }

    @Test
    void sample_row_keys_streams_split_points_then_table_end() {
        for (String k : List.of("a", "b", "c")) {
            service.table("t").apply(RowKeys.of(k), List.of(Mutation.setCell("f", "c", 1, "v")));
        }

        List<RowStoreProto.SampleRowKeysResponse> samples = new ArrayList<>();
        stub.sampleRowKeys(RowStoreProto.SampleRowKeysRequest.newBuilder().setTableName("t").build())
                .forEachRemaining(samples::add);

        assertEquals(2, samples.size());
        assertEquals(RowKeys.of("c"), samples.get(0).getRowKey());
        assertEquals(24, samples.get(0).getOffsetBytes());
        assertEquals(ByteString.EMPTY, samples.get(1).getRowKey());
        assertEquals(36, samples.get(1).getOffsetBytes());
    }

    @Test
    void broken_sample_row_keys_sends_one_sample_then_error() {
        for (String k : List.of("a", "b", "c")) {
            service.table("t").apply(RowKeys.of(k), List.of(Mutation.setCell("f", "c", 1, "v")));
        }
        service.faults().breakNextSampleRowKeys(Status.UNAVAILABLE);

        var it = stub.sampleRowKeys(RowStoreProto.SampleRowKeysRequest.newBuilder().setTableName("t").build());
        List<RowStoreProto.SampleRowKeysResponse> samples = new ArrayList<>();
        var ex = assertThrows(StatusRuntimeException.class, () -> it.forEachRemaining(samples::add));

        assertEquals(Status.Code.UNAVAILABLE, ex.getStatus().getCode());
        assertEquals(1, samples.size());
    }
}
