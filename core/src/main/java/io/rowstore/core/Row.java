// file: core/src/main/java/io/rowstore/core/Row.java
package io.rowstore.core;

import com.google.protobuf.ByteString;

import java.util.List;
import java.util.Objects;

/** A row key and its cells, in the order the server returned them. */
public record Row(ByteString rowKey, List<Cell> cells) {

    public Row {
        Objects.requireNonNull(rowKey, "rowKey");
        cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
    }

    public String rowKeyUtf8() {
        return rowKey.toStringUtf8();
    }

    @Override
    public String toString() {
        return "Row{" + RowKeys.debugString(rowKey) + ", cells=" + cells + "}";
    }
}
