// file: core/src/main/java/io/rowstore/core/SingleRowMutation.java
package io.rowstore.core;

import com.google.protobuf.ByteString;
import io.rowstore.proto.RowStoreProto;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A row key and the ordered mutations to apply to it.
 * <p>
 * All mutations of one entry are applied atomically by the server. The client
 * never splits an entry across requests: it is sent, acknowledged and retried
 * as a whole.
 */
public record SingleRowMutation(ByteString rowKey, List<Mutation> mutations) {

    public SingleRowMutation {
        Objects.requireNonNull(rowKey, "rowKey");
        if (rowKey.isEmpty()) {
            throw new IllegalArgumentException("rowKey must not be empty");
        }
        mutations = List.copyOf(Objects.requireNonNull(mutations, "mutations"));
    }

    public static SingleRowMutation of(String rowKey, Mutation... mutations) {
        return new SingleRowMutation(RowKeys.of(rowKey), List.of(mutations));
    }

    public static SingleRowMutation of(ByteString rowKey, Mutation... mutations) {
        return new SingleRowMutation(rowKey, List.of(mutations));
    }

    public RowStoreProto.MutateRowsRequest.Entry toEntryProto() {
        var b = RowStoreProto.MutateRowsRequest.Entry.newBuilder().setRowKey(rowKey);
        for (var m : mutations) {
            b.addMutations(m.toProto());
        }
        return b.build();
    }

    public List<RowStoreProto.Mutation> mutationProtos() {
        List<RowStoreProto.Mutation> out = new ArrayList<>(mutations.size());
        for (var m : mutations) {
            out.add(m.toProto());
        }
        return out;
    }

    @Override
    public String toString() {
        return "SingleRowMutation{rowKey=" + RowKeys.debugString(rowKey) + ", mutations=" + mutations.size() + "}";
    }
}
