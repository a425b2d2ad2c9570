// file: core/src/main/java/io/rowstore/core/RowKeySet.java
package io.rowstore.core;

import com.google.protobuf.ByteString;
import io.rowstore.proto.RowStoreProto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A set of rows to read: individual keys plus key ranges.
 * <p>
 * Semantics:
 *  - A set with no keys and no ranges means "all rows" when sent to the server.
 *  - Order and duplicates do not matter for correctness.
 *  - {@link #intersect(RowKeyRange)} shrinks the set in place; when nothing
 *    survives, the set keeps a single empty range so that it reads as
 *    "no rows" rather than "all rows".
 * <p>
 * Not thread safe. Readers take a {@link #copy()} before mutating.
 */
public final class RowKeySet {

    private final List<ByteString> keys = new ArrayList<>();
    private final List<RowKeyRange> ranges = new ArrayList<>();

    public RowKeySet() {
    }

    /** All rows. */
    public static RowKeySet all() {
        return new RowKeySet();
    }

    public static RowKeySet of(ByteString... keys) {
        var s = new RowKeySet();
        for (var k : keys) {
            s.append(k);
        }
        return s;
    }

    public static RowKeySet of(String... keys) {
        var s = new RowKeySet();
        for (var k : keys) {
            s.append(RowKeys.of(k));
        }
        return s;
    }

    public static RowKeySet of(RowKeyRange... ranges) {
        var s = new RowKeySet();
        for (var r : ranges) {
            s.append(r);
        }
        return s;
    }

    public RowKeySet append(ByteString key) {
        keys.add(Objects.requireNonNull(key, "key"));
        return this;
    }

    public RowKeySet append(RowKeyRange range) {
        ranges.add(Objects.requireNonNull(range, "range"));
        return this;
    }

    public List<ByteString> keys() {
        return Collections.unmodifiableList(keys);
    }

    public List<RowKeyRange> ranges() {
        return Collections.unmodifiableList(ranges);
    }

    /** True when this set selects every row (nothing was ever added). */
    public boolean isAllRows() {
        return keys.isEmpty() && ranges.isEmpty();
    }

    /**
     * True when this set selects no row at all: it has no keys and every range
     * is empty. A set with nothing in it means "all rows" and is not empty.
     */
    public boolean isEmpty() {
        if (!keys.isEmpty()) {
            return false;
        }
        for (var r : ranges) {
            if (!r.isEmpty()) {
                return false;
            }
        }
        return !ranges.isEmpty();
    }

    /**
     * Restrict this set to {@code range}, in place.
     * <ul>
     *   <li>"all rows" becomes just {@code range};</li>
     *   <li>keys outside {@code range} are dropped;</li>
     *   <li>each range is replaced by its intersection with {@code range},
     *       empty intersections are dropped.</li>
     * </ul>
     */
    public RowKeySet intersect(RowKeyRange range) {
        Objects.requireNonNull(range, "range");
        if (isAllRows()) {
            ranges.add(range);
            return this;
        }
        keys.removeIf(k -> !range.contains(k));

        List<RowKeyRange> kept = new ArrayList<>(ranges.size());
        for (var r : ranges) {
            var i = r.intersect(range);
            if (i.nonEmpty()) {
                kept.add(i.range());
            }
        }
        ranges.clear();
        ranges.addAll(kept);

        if (keys.isEmpty() && ranges.isEmpty()) {
            ranges.add(RowKeyRange.empty());
        }
        return this;
    }

    public RowKeySet copy() {
        var c = new RowKeySet();
        c.keys.addAll(keys);
        c.ranges.addAll(ranges);
        return c;
    }

    public RowStoreProto.RowSet toProto() {
        var b = RowStoreProto.RowSet.newBuilder().addAllRowKeys(keys);
        for (var r : ranges) {
            b.addRowRanges(r.toProto());
        }
        return b.build();
    }

    public static RowKeySet fromProto(RowStoreProto.RowSet proto) {
        var s = new RowKeySet();
        s.keys.addAll(proto.getRowKeysList());
        for (var r : proto.getRowRangesList()) {
            s.ranges.add(RowKeyRange.fromProto(r));
        }
        return s;
    }

    /** True if {@code key} is selected by this set. */
    public boolean contains(ByteString key) {
        if (isAllRows()) {
            return true;
        }
        for (var k : keys) {
            if (k.equals(key)) {
                return true;
            }
        }
        for (var r : ranges) {
            if (r.contains(key)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        var ks = keys.stream().map(RowKeys::debugString).toList();
        return "RowKeySet{keys=" + ks + ", ranges=" + ranges + "}";
    }
}
