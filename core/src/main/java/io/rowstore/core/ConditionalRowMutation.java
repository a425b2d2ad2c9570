// file: core/src/main/java/io/rowstore/core/ConditionalRowMutation.java
package io.rowstore.core;

import com.google.protobuf.ByteString;
import io.rowstore.proto.RowStoreProto;

import java.util.List;
import java.util.Objects;

/**
 * A read-check-write on one row, applied atomically by the server.
 * <p>
 * The server runs {@code predicate} over the row. If it yields any cell,
 * {@code ifMatched} is applied, otherwise {@code otherwise}. Either list may be
 * empty, but not both.
 */
public record ConditionalRowMutation(
        ByteString rowKey,
        Filter predicate,
        List<Mutation> ifMatched,
        List<Mutation> otherwise
) {

    public ConditionalRowMutation {
        Objects.requireNonNull(rowKey, "rowKey");
        if (rowKey.isEmpty()) {
            throw new IllegalArgumentException("rowKey must not be empty");
        }
        Objects.requireNonNull(predicate, "predicate");
        ifMatched = List.copyOf(Objects.requireNonNull(ifMatched, "ifMatched"));
        otherwise = List.copyOf(Objects.requireNonNull(otherwise, "otherwise"));
        if (ifMatched.isEmpty() && otherwise.isEmpty()) {
            throw new IllegalArgumentException("ifMatched and otherwise must not both be empty");
        }
    }

    public static ConditionalRowMutation of(
            String rowKey, Filter predicate, List<Mutation> ifMatched, List<Mutation> otherwise) {
        return new ConditionalRowMutation(RowKeys.of(rowKey), predicate, ifMatched, otherwise);
    }

    public RowStoreProto.CheckAndMutateRowRequest toRequest(String tableName) {
        var b = RowStoreProto.CheckAndMutateRowRequest.newBuilder()
                .setTableName(tableName)
                .setRowKey(rowKey)
                .setPredicateFilter(predicate.toProto());
        for (var m : ifMatched) {
            b.addTrueMutations(m.toProto());
        }
        for (var m : otherwise) {
            b.addFalseMutations(m.toProto());
        }
        return b.build();
    }

    @Override
    public String toString() {
        return "ConditionalRowMutation{rowKey=" + RowKeys.debugString(rowKey)
                + ", ifMatched=" + ifMatched.size() + ", otherwise=" + otherwise.size() + "}";
    }
}
