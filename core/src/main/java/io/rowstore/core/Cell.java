// file: core/src/main/java/io/rowstore/core/Cell.java
package io.rowstore.core;

import com.google.protobuf.ByteString;
import com.google.protobuf.UnsafeByteOperations;

import java.util.List;
import java.util.Objects;

/**
 * One cell of a row: (row key, family, qualifier, timestamp) plus a value and labels.
 * <p>
 * The value arrives as one or more fragments. They are concatenated lazily, at
 * most once per instance; every later {@link #value()} call returns the very
 * same {@link ByteString}, so callers may compare values by identity and take
 * repeated zero-copy views ({@code asReadOnlyByteBuffer()}) of one backing array.
 */
public final class Cell {

    private final ByteString rowKey;
    private final String family;
    private final ByteString qualifier;
    private final long timestampMicros;
    private final List<String> labels;

    // guarded by this; fragments is released once value is materialized
    private List<ByteString> fragments;
    private ByteString value;

    public Cell(ByteString rowKey, String family, ByteString qualifier, long timestampMicros,
                List<ByteString> fragments, List<String> labels) {
        this.rowKey = Objects.requireNonNull(rowKey, "rowKey");
        this.family = Objects.requireNonNull(family, "family");
        this.qualifier = Objects.requireNonNull(qualifier, "qualifier");
        this.timestampMicros = timestampMicros;
        this.fragments = List.copyOf(Objects.requireNonNull(fragments, "fragments"));
        this.labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
    }

    /** Single-fragment cell. */
    public Cell(ByteString rowKey, String family, ByteString qualifier, long timestampMicros,
                ByteString value, List<String> labels) {
        this(rowKey, family, qualifier, timestampMicros, List.of(value), labels);
    }

    public ByteString rowKey() { return rowKey; }

    public String family() { return family; }

    public ByteString qualifier() { return qualifier; }

    public long timestampMicros() { return timestampMicros; }

    public List<String> labels() { return labels; }

    /** Concatenated value; computed on first call, identical instance afterwards. */
    public synchronized ByteString value() {
        if (value == null) {
            value = concat(fragments);
            fragments = null;
        }
        return value;
    }

    /**
     * Concatenate fragments in order, skipping empty ones.
     * Zero non-empty fragments give the empty value, exactly one is returned as is,
     * more are copied into a single flat array.
     */
    static ByteString concat(List<ByteString> fragments) {
        int total = 0;
        int nonEmpty = 0;
        ByteString only = ByteString.EMPTY;
        for (var f : fragments) {
            if (!f.isEmpty()) {
                total += f.size();
                nonEmpty++;
                only = f;
            }
        }
        if (nonEmpty <= 1) {
            return only;
        }
        byte[] out = new byte[total];
        int offset = 0;
        for (var f : fragments) {
            f.copyTo(out, offset);
            offset += f.size();
        }
        return UnsafeByteOperations.unsafeWrap(out);
    }

    @Override
    public String toString() {
        return "Cell{" + RowKeys.debugString(rowKey) + " " + family + ":" + RowKeys.debugString(qualifier)
                + " @" + timestampMicros + "}";
    }
}
