// file: client/src/main/java/io/rowstore/client/ReadRowsParser.java
package io.rowstore.client;

import com.google.protobuf.ByteString;
import io.grpc.Status;
import io.rowstore.core.Cell;
import io.rowstore.core.CellMerger;
import io.rowstore.core.Row;
import io.rowstore.core.RowKeys;
import io.rowstore.core.RowStoreException;
import io.rowstore.proto.RowStoreProto;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Turns the cell chunks of one ReadRows stream back into rows.
 * <p>
 * Chunk rules:
 *  - A non-empty row key starts a row; it must sort after the last committed row.
 *  - A chunk that does not continue a split cell starts a new cell. Family and
 *    qualifier carry over from the previous cell of the row when absent; a
 *    family always comes with a qualifier.
 *  - {@code valueSize > 0} means the value continues in the next chunk.
 *  - {@code resetRow} drops the row in progress, {@code commitRow} completes it.
 *  - The stream must not end inside a row.
 * <p>
 * Violations throw {@link RowStoreException} with status INTERNAL.
 * One parser serves one stream: after a failure, start over with a new one.
 */
public final class ReadRowsParser {

    private ByteString lastCommittedKey;

    // row in progress
    private ByteString rowKey;
    private final List<Cell> cells = new ArrayList<>();
    private String family;
    private ByteString qualifier;

    // cell in progress, non-null only while a split cell is open
    private CellMerger cell;
    private int expectedSize;

    private Row completed;

    public void handleChunk(RowStoreProto.ReadRowsResponse.CellChunk chunk) {
        if (completed != null) {
            throw new IllegalStateException("call next() before handing over more chunks");
        }

        if (chunk.getResetRow()) {
            reset(chunk);
            return;
        }

        if (cell != null) {
            continueCell(chunk);
        } else {
            startCell(chunk);
        }

        if (chunk.getValueSize() > 0) {
            if (expectedSize != 0 && expectedSize != chunk.getValueSize()) {
                throw protocolError("value size changed within a cell");
            }
            expectedSize = chunk.getValueSize();
        } else {
            if (expectedSize != 0 && cell.size() != expectedSize) {
                throw protocolError("split cell has " + cell.size() + " bytes, expected " + expectedSize);
            }
            cells.add(cell.build());
            cell = null;
            expectedSize = 0;
        }

        if (chunk.getCommitRow()) {
            if (cell != null) {
                throw protocolError("row committed inside a split cell");
            }
            completed = new Row(rowKey, cells);
            lastCommittedKey = rowKey;
            clearRow();
        }
    }

    private void reset(RowStoreProto.ReadRowsResponse.CellChunk chunk) {
        if (rowKey == null) {
            throw protocolError("reset without a row in progress");
        }
        if (!chunk.getRowKey().isEmpty() || chunk.hasFamilyName() || chunk.hasQualifier()
                || chunk.getTimestampMicros() != 0 || chunk.getLabelsCount() > 0
                || !chunk.getValue().isEmpty() || chunk.getValueSize() != 0) {
            throw protocolError("reset chunk carries cell data");
        }
        clearRow();
    }

    private void startCell(RowStoreProto.ReadRowsResponse.CellChunk chunk) {
        ByteString key = chunk.getRowKey();
        if (rowKey == null) {
            if (key.isEmpty()) {
                throw protocolError("first chunk of a row has no row key");
            }
            if (lastCommittedKey != null && RowKeys.compare(key, lastCommittedKey) <= 0) {
                throw protocolError("row key " + RowKeys.debugString(key)
                        + " does not sort after " + RowKeys.debugString(lastCommittedKey));
            }
            rowKey = key;
        } else if (!key.isEmpty() && !key.equals(rowKey)) {
            throw protocolError("row key changed before commit");
        }

        if (chunk.hasFamilyName()) {
            if (!chunk.hasQualifier()) {
                throw protocolError("family without qualifier");
            }
            family = chunk.getFamilyName().getValue();
        }
        if (chunk.hasQualifier()) {
            if (family == null) {
                throw protocolError("qualifier without family");
            }
            qualifier = chunk.getQualifier().getValue();
        }
        if (family == null) {
            throw protocolError("cell without family and qualifier");
        }

        cell = new CellMerger(rowKey, family, qualifier, chunk.getTimestampMicros(), chunk.getLabelsList());
        cell.append(chunk.getValue());
    }

    private void continueCell(RowStoreProto.ReadRowsResponse.CellChunk chunk) {
        if (!chunk.getRowKey().isEmpty() || chunk.hasFamilyName() || chunk.hasQualifier()) {
            throw protocolError("cell header inside a split cell");
        }
        cell.append(chunk.getValue());
    }

    private void clearRow() {
        rowKey = null;
        cells.clear();
        family = null;
        qualifier = null;
        cell = null;
        expectedSize = 0;
    }

    /** True when a committed row is waiting to be taken. */
    public boolean hasNext() {
        return completed != null;
    }

    public Row next() {
        if (completed == null) {
            throw new NoSuchElementException();
        }
        Row r = completed;
        completed = null;
        return r;
    }

    /** The stream finished cleanly; fails if it left a row half done. */
    public void handleEndOfStream() {
        if (rowKey != null) {
            throw protocolError("stream ended inside row " + RowKeys.debugString(rowKey));
        }
    }

    private static RowStoreException protocolError(String message) {
        return new RowStoreException(Status.INTERNAL.withDescription("ReadRows protocol error: " + message));
    }
}
