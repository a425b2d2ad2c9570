// file: core/src/main/java/io/rowstore/core/Mutation.java
package io.rowstore.core;

import com.google.protobuf.ByteString;
import io.rowstore.proto.RowStoreProto;

import java.util.Objects;

/**
 * A single change to one row.
 * <p>
 * Four kinds exist, one record each:
 *  - {@link SetCell}:          write a value at (family, qualifier, timestamp).
 *  - {@link DeleteFromColumn}: delete cells of a column within a time range.
 *  - {@link DeleteFromFamily}: delete every cell of a family.
 *  - {@link DeleteFromRow}:    delete the whole row.
 * <p>
 * Mutations are immutable. A SetCell whose timestamp is
 * {@link #SERVER_SET_TIMESTAMP} is stamped by the server on arrival, so sending
 * it twice may create two cells; see the retry package for how that affects
 * retries.
 */
public interface Mutation {

    /** Timestamp value asking the server to assign the time. */
    long SERVER_SET_TIMESTAMP = -1L;

    RowStoreProto.Mutation toProto();

    /** True if the server picks the timestamp for this mutation. */
    default boolean hasServerAssignedTimestamp() {
        return false;
    }

    record SetCell(String family, ByteString qualifier, long timestampMicros, ByteString value)
            implements Mutation {
        public SetCell {
            requireFamily(family);
            Objects.requireNonNull(qualifier, "qualifier");
            Objects.requireNonNull(value, "value");
            if (timestampMicros < SERVER_SET_TIMESTAMP) {
                throw new IllegalArgumentException("timestampMicros must be >= -1, got " + timestampMicros);
            }
        }

        @Override
        public boolean hasServerAssignedTimestamp() {
            return timestampMicros == SERVER_SET_TIMESTAMP;
        }

        @Override
        public RowStoreProto.Mutation toProto() {
            return RowStoreProto.Mutation.newBuilder()
                    .setSetCell(RowStoreProto.Mutation.SetCell.newBuilder()
                            .setFamilyName(family)
                            .setColumnQualifier(qualifier)
                            .setTimestampMicros(timestampMicros)
                            .setValue(value))
                    .build();
        }
    }

    /** Time range is [startMicros, endMicros); 0 leaves that side unbounded. */
    record DeleteFromColumn(String family, ByteString qualifier, long startMicros, long endMicros)
            implements Mutation {
        public DeleteFromColumn {
            requireFamily(family);
            Objects.requireNonNull(qualifier, "qualifier");
            if (startMicros < 0 || endMicros < 0) {
                throw new IllegalArgumentException("timestamps must be >= 0");
            }
            if (startMicros != 0 && endMicros != 0 && endMicros <= startMicros) {
                throw new IllegalArgumentException(
                        "empty time range [" + startMicros + ", " + endMicros + ")");
            }
        }

        @Override
        public RowStoreProto.Mutation toProto() {
            return RowStoreProto.Mutation.newBuilder()
                    .setDeleteFromColumn(RowStoreProto.Mutation.DeleteFromColumn.newBuilder()
                            .setFamilyName(family)
                            .setColumnQualifier(qualifier)
                            .setTimeRange(RowStoreProto.TimestampRange.newBuilder()
                                    .setStartTimestampMicros(startMicros)
                                    .setEndTimestampMicros(endMicros)))
                    .build();
        }
    }

    record DeleteFromFamily(String family) implements Mutation {
        public DeleteFromFamily {
            requireFamily(family);
        }

        @Override
        public RowStoreProto.Mutation toProto() {
            return RowStoreProto.Mutation.newBuilder()
                    .setDeleteFromFamily(RowStoreProto.Mutation.DeleteFromFamily.newBuilder()
                            .setFamilyName(family))
                    .build();
        }
    }

    record DeleteFromRow() implements Mutation {
        @Override
        public RowStoreProto.Mutation toProto() {
            return RowStoreProto.Mutation.newBuilder()
                    .setDeleteFromRow(RowStoreProto.Mutation.DeleteFromRow.getDefaultInstance())
                    .build();
        }
    }

    // ---------- factories ----------

    static SetCell setCell(String family, String qualifier, long timestampMicros, String value) {
        return new SetCell(family, RowKeys.of(qualifier), timestampMicros, RowKeys.of(value));
    }

    static SetCell setCell(String family, ByteString qualifier, long timestampMicros, ByteString value) {
        return new SetCell(family, qualifier, timestampMicros, value);
    }

    /** SetCell stamped by the server. Not idempotent, not retried by default. */
    static SetCell setCell(String family, String qualifier, String value) {
        return new SetCell(family, RowKeys.of(qualifier), SERVER_SET_TIMESTAMP, RowKeys.of(value));
    }

    static DeleteFromColumn deleteFromColumn(String family, String qualifier) {
        return new DeleteFromColumn(family, RowKeys.of(qualifier), 0, 0);
    }

    static DeleteFromColumn deleteFromColumn(String family, String qualifier, long startMicros, long endMicros) {
        return new DeleteFromColumn(family, RowKeys.of(qualifier), startMicros, endMicros);
    }

    static DeleteFromColumn deleteFromColumnStartingFrom(String family, String qualifier, long startMicros) {
        return new DeleteFromColumn(family, RowKeys.of(qualifier), startMicros, 0);
    }

    static DeleteFromColumn deleteFromColumnEndingAt(String family, String qualifier, long endMicros) {
        return new DeleteFromColumn(family, RowKeys.of(qualifier), 0, endMicros);
    }

    static DeleteFromFamily deleteFromFamily(String family) {
        return new DeleteFromFamily(family);
    }

    static DeleteFromRow deleteFromRow() {
        return new DeleteFromRow();
    }

    /** Decode the wire form. Throws IllegalArgumentException when no kind is set. */
    static Mutation fromProto(RowStoreProto.Mutation proto) {
        return switch (proto.getMutationCase()) {
            case SET_CELL -> {
                var s = proto.getSetCell();
                yield new SetCell(s.getFamilyName(), s.getColumnQualifier(), s.getTimestampMicros(), s.getValue());
            }
            case DELETE_FROM_COLUMN -> {
                var d = proto.getDeleteFromColumn();
                yield new DeleteFromColumn(
                        d.getFamilyName(),
                        d.getColumnQualifier(),
                        d.getTimeRange().getStartTimestampMicros(),
                        d.getTimeRange().getEndTimestampMicros());
            }
            case DELETE_FROM_FAMILY -> new DeleteFromFamily(proto.getDeleteFromFamily().getFamilyName());
            case DELETE_FROM_ROW -> new DeleteFromRow();
            case MUTATION_NOT_SET -> throw new IllegalArgumentException("mutation kind not set");
        };
    }

    private static void requireFamily(String family) {
        Objects.requireNonNull(family, "family");
        if (family.isEmpty()) {
            throw new IllegalArgumentException("family must not be empty");
        }
    }
}
