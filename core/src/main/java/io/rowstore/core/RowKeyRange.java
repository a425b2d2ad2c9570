// file: core/src/main/java/io/rowstore/core/RowKeyRange.java
package io.rowstore.core;

import com.google.protobuf.ByteString;
import io.rowstore.proto.RowStoreProto;

import java.util.Objects;

/**
 * Interval over binary row keys.
 * <p>
 * Each endpoint is either unbounded, closed (inclusive) or open (exclusive).
 * Keys compare as unsigned byte sequences (see {@link RowKeys}).
 * <p>
 * Design:
 *  - Immutable value object; equals/hashCode over both bounds.
 *  - Any combination of bounds is well-formed. Emptiness is a derived
 *    predicate ({@link #isEmpty()}), never a constructor precondition.
 */
public final class RowKeyRange {

    public enum BoundType { UNBOUNDED, CLOSED, OPEN }

    /** One endpoint. {@code key} is empty for unbounded endpoints. */
    public record Bound(BoundType type, ByteString key) {
        public Bound {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(key, "key");
            if (type == BoundType.UNBOUNDED) {
                key = ByteString.EMPTY;
            }
        }

        public static Bound unbounded() { return new Bound(BoundType.UNBOUNDED, ByteString.EMPTY); }
        public static Bound closed(ByteString key) { return new Bound(BoundType.CLOSED, key); }
        public static Bound open(ByteString key) { return new Bound(BoundType.OPEN, key); }

        public boolean isUnbounded() { return type == BoundType.UNBOUNDED; }
        public boolean isOpen() { return type == BoundType.OPEN; }
    }

    /** Result of {@link #intersect(RowKeyRange)}. */
    public record Intersection(boolean nonEmpty, RowKeyRange range) {}

    private static final RowKeyRange INFINITE = new RowKeyRange(Bound.unbounded(), Bound.unbounded());

    private final Bound start;
    private final Bound end;

    public RowKeyRange(Bound start, Bound end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    // ---------- factories ----------

    /** All rows. */
    public static RowKeyRange infinite() { return INFINITE; }

    /** A range that contains no keys. */
    public static RowKeyRange empty() {
        return new RowKeyRange(Bound.open(ByteString.EMPTY), Bound.open(ByteString.EMPTY));
    }

    /** [begin, +inf) */
    public static RowKeyRange startingAt(ByteString begin) {
        return new RowKeyRange(Bound.closed(begin), Bound.unbounded());
    }

    /** (-inf, end] */
    public static RowKeyRange endingAt(ByteString end) {
        return new RowKeyRange(Bound.unbounded(), Bound.closed(end));
    }

    /** [begin, end), the usual range shape. */
    public static RowKeyRange range(ByteString begin, ByteString end) {
        return rightOpen(begin, end);
    }

    /** [begin, end) */
    public static RowKeyRange rightOpen(ByteString begin, ByteString end) {
        return new RowKeyRange(Bound.closed(begin), Bound.open(end));
    }

    /** (begin, end] */
    public static RowKeyRange leftOpen(ByteString begin, ByteString end) {
        return new RowKeyRange(Bound.open(begin), Bound.closed(end));
    }

    /** (begin, end) */
    public static RowKeyRange open(ByteString begin, ByteString end) {
        return new RowKeyRange(Bound.open(begin), Bound.open(end));
    }

    /** [begin, end] */
    public static RowKeyRange closed(ByteString begin, ByteString end) {
        return new RowKeyRange(Bound.closed(begin), Bound.closed(end));
    }

    /** (key, +inf): everything strictly after {@code key}. */
    public static RowKeyRange after(ByteString key) {
        return new RowKeyRange(Bound.open(key), Bound.unbounded());
    }

    /** Every key that starts with {@code prefix}. */
    public static RowKeyRange prefix(ByteString prefix) {
        ByteString end = RowKeys.prefixEnd(prefix);
        return new RowKeyRange(Bound.closed(prefix), end == null ? Bound.unbounded() : Bound.open(end));
    }

    public Bound start() { return start; }

    public Bound end() { return end; }

    // ---------- predicates ----------

    /**
     * True when no key lies in this range.
     * <p>
     * An open start is replaced by the smallest key above it (key + 0x00), an
     * unbounded start by the empty key, which turns every start into a closed
     * one. Then: an unbounded end is never empty, a closed end is empty iff
     * start > end, an open end is empty iff start >= end.
     */
    public boolean isEmpty() {
        if (end.isUnbounded()) {
            return false;
        }
        ByteString s = switch (start.type()) {
            case UNBOUNDED -> ByteString.EMPTY;
            case CLOSED -> start.key();
            case OPEN -> RowKeys.successor(start.key());
        };
        int cmp = RowKeys.compare(s, end.key());
        return end.isOpen() ? cmp >= 0 : cmp > 0;
    }

    /** True iff {@code key} is above the start bound and below the end bound. */
    public boolean contains(ByteString key) {
        return aboveStart(key) && belowEnd(key);
    }

    public boolean aboveStart(ByteString key) {
        if (start.isUnbounded()) {
            return true;
        }
        int cmp = RowKeys.compare(key, start.key());
        return start.isOpen() ? cmp > 0 : cmp >= 0;
    }

    public boolean belowEnd(ByteString key) {
        if (end.isUnbounded()) {
            return true;
        }
        int cmp = RowKeys.compare(key, end.key());
        return end.isOpen() ? cmp < 0 : cmp <= 0;
    }

    /**
     * Intersect with another range: the tighter of the two starts and the
     * tighter of the two ends. On equal keys the open bound wins.
     */
    public Intersection intersect(RowKeyRange other) {
        RowKeyRange r = new RowKeyRange(tighterStart(start, other.start), tighterEnd(end, other.end));
        return new Intersection(!r.isEmpty(), r);
    }

    private static Bound tighterStart(Bound a, Bound b) {
        if (a.isUnbounded()) return b;
        if (b.isUnbounded()) return a;
        int cmp = RowKeys.compare(a.key(), b.key());
        if (cmp != 0) return cmp > 0 ? a : b;
        return a.isOpen() ? a : b;
    }

    private static Bound tighterEnd(Bound a, Bound b) {
        if (a.isUnbounded()) return b;
        if (b.isUnbounded()) return a;
        int cmp = RowKeys.compare(a.key(), b.key());
        if (cmp != 0) return cmp < 0 ? a : b;
        return a.isOpen() ? a : b;
    }

    // ---------- wire form ----------

    public RowStoreProto.RowRange toProto() {
        var b = RowStoreProto.RowRange.newBuilder();
        switch (start.type()) {
            case CLOSED -> b.setStartKeyClosed(start.key());
            case OPEN -> b.setStartKeyOpen(start.key());
            case UNBOUNDED -> { }
        }
        switch (end.type()) {
            case CLOSED -> b.setEndKeyClosed(end.key());
            case OPEN -> b.setEndKeyOpen(end.key());
            case UNBOUNDED -> { }
        }
        return b.build();
    }

    public static RowKeyRange fromProto(RowStoreProto.RowRange proto) {
        Bound s = switch (proto.getStartKeyCase()) {
            case START_KEY_CLOSED -> Bound.closed(proto.getStartKeyClosed());
            case START_KEY_OPEN -> Bound.open(proto.getStartKeyOpen());
            case STARTKEY_NOT_SET -> Bound.unbounded();
        };
        Bound e = switch (proto.getEndKeyCase()) {
            case END_KEY_CLOSED -> Bound.closed(proto.getEndKeyClosed());
            case END_KEY_OPEN -> Bound.open(proto.getEndKeyOpen());
            case ENDKEY_NOT_SET -> Bound.unbounded();
        };
        return new RowKeyRange(s, e);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RowKeyRange other)) return false;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        String s = switch (start.type()) {
            case UNBOUNDED -> "(-inf";
            case CLOSED -> "[" + RowKeys.debugString(start.key());
            case OPEN -> "(" + RowKeys.debugString(start.key());
        };
        String e = switch (end.type()) {
            case UNBOUNDED -> "+inf)";
            case CLOSED -> RowKeys.debugString(end.key()) + "]";
            case OPEN -> RowKeys.debugString(end.key()) + ")";
        };
        return "RowKeyRange" + s + "," + e;
    }
}
