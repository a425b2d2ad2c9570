// file: core/src/main/java/io/rowstore/core/RowKeySample.java
package io.rowstore.core;

import com.google.protobuf.ByteString;

import java.util.Objects;

/**
 * A split point of a table: a row key and the approximate number of bytes
 * stored in the rows before it. An empty key marks the end of the table.
 */
public record RowKeySample(ByteString rowKey, long offsetBytes) {

    public RowKeySample {
        Objects.requireNonNull(rowKey, "rowKey");
        if (offsetBytes < 0) {
            throw new IllegalArgumentException("offsetBytes must be >= 0, got " + offsetBytes);
        }
    }

    public boolean isTableEnd() {
        return rowKey.isEmpty();
    }

    @Override
    public String toString() {
        return "RowKeySample{rowKey=" + (isTableEnd() ? "<end>" : RowKeys.debugString(rowKey))
                + ", offsetBytes=" + offsetBytes + "}";
    }
}
