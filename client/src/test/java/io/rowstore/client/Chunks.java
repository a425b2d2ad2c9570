// file: client/src/test/java/io/rowstore/client/Chunks.java
package io.rowstore.client;

import com.google.protobuf.BytesValue;
import com.google.protobuf.StringValue;
import io.rowstore.core.RowKeys;
import io.rowstore.proto.RowStoreProto;

import java.util.List;

/** Builders for hand-written ReadRows chunk streams. */
final class Chunks {

    private Chunks() {
        // utility
    }

    /** First chunk of a cell; pass rowKey null to omit it. */
    static RowStoreProto.ReadRowsResponse.CellChunk.Builder cell(
            String rowKey, String family, String qualifier, long ts, String value) {
        var b = RowStoreProto.ReadRowsResponse.CellChunk.newBuilder()
                .setTimestampMicros(ts)
                .setValue(RowKeys.of(value));
        if (rowKey != null) {
            b.setRowKey(RowKeys.of(rowKey));
        }
        if (family != null) {
            b.setFamilyName(StringValue.of(family));
        }
        if (qualifier != null) {
            b.setQualifier(BytesValue.of(RowKeys.of(qualifier)));
        }
        return b;
    }

    static RowStoreProto.ReadRowsResponse.CellChunk.Builder continuation(String value) {
        return RowStoreProto.ReadRowsResponse.CellChunk.newBuilder().setValue(RowKeys.of(value));
    }

    /** A whole committed single-cell row. */
    static RowStoreProto.ReadRowsResponse.CellChunk row(String rowKey, String value) {
        return cell(rowKey, "fam", "col", 1, value).setCommitRow(true).build();
    }

    static RowStoreProto.ReadRowsResponse response(RowStoreProto.ReadRowsResponse.CellChunk... chunks) {
        return RowStoreProto.ReadRowsResponse.newBuilder().addAllChunks(List.of(chunks)).build();
    }

    static RowStoreProto.ReadRowsResponse rows(String... keys) {
        var b = RowStoreProto.ReadRowsResponse.newBuilder();
        for (String k : keys) {
            b.addChunks(row(k, "v-" + k));
        }
        return b.build();
    }
}
