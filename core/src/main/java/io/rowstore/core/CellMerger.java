// file: core/src/main/java/io/rowstore/core/CellMerger.java
package io.rowstore.core;

import com.google.protobuf.ByteString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects the fragments of one logical cell as they arrive from a read stream.
 * <p>
 * Fragments keep their arrival order. Empty fragments are dropped, so they never
 * separate the non-empty fragments around them. {@link #build()} hands the
 * fragments to a {@link Cell}, which concatenates them on first access.
 */
public final class CellMerger {

    private final ByteString rowKey;
    private final String family;
    private final ByteString qualifier;
    private final long timestampMicros;
    private final List<String> labels;
    private final List<ByteString> fragments = new ArrayList<>();
    private long bytes;

    public CellMerger(ByteString rowKey, String family, ByteString qualifier,
                      long timestampMicros, List<String> labels) {
        this.rowKey = Objects.requireNonNull(rowKey, "rowKey");
        this.family = Objects.requireNonNull(family, "family");
        this.qualifier = Objects.requireNonNull(qualifier, "qualifier");
        this.timestampMicros = timestampMicros;
        this.labels = List.copyOf(labels);
    }

    public CellMerger append(ByteString fragment) {
        Objects.requireNonNull(fragment, "fragment");
        if (!fragment.isEmpty()) {
            fragments.add(fragment);
            bytes += fragment.size();
        }
        return this;
    }

    /** Bytes received so far. */
    public long size() {
        return bytes;
    }

    public Cell build() {
        return new Cell(rowKey, family, qualifier, timestampMicros, fragments, labels);
    }

    /** Merge a fixed list of fragments in one go. */
    public static Cell merge(ByteString rowKey, String family, ByteString qualifier,
                             long timestampMicros, List<ByteString> fragments, List<String> labels) {
        var m = new CellMerger(rowKey, family, qualifier, timestampMicros, labels);
        fragments.forEach(m::append);
        return m.build();
    }
}
