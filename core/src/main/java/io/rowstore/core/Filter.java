// file: core/src/main/java/io/rowstore/core/Filter.java
package io.rowstore.core;

import com.google.protobuf.ByteString;
import io.rowstore.proto.RowStoreProto;

import java.time.Instant;
import java.util.Objects;

/**
 * Server-side row filter applied by reads and by conditional mutations.
 * Thin immutable wrapper over the wire form; build with the static factories.
 * <p>
 * Filters see the cells of one row at a time, ordered by family, qualifier and
 * newest timestamp first. Regular expressions must match the whole family,
 * qualifier, row key or value; byte patterns are matched byte for byte.
 * <p>
 * Ranges come in four shapes. {@code columnRange}/{@code valueRange} are the
 * common {@code [start, end)}; the {@code LeftOpen}, {@code Closed} and
 * {@code Open} variants cover {@code (start, end]}, {@code [start, end]} and
 * {@code (start, end)}.
 */
public final class Filter {

    private static final Filter PASS_ALL =
            new Filter(RowStoreProto.RowFilter.newBuilder().setPassAllFilter(true).build());

    private final RowStoreProto.RowFilter proto;

    private Filter(RowStoreProto.RowFilter proto) {
        this.proto = proto;
    }

    private static Filter of(RowStoreProto.RowFilter.Builder b) {
        return new Filter(b.build());
    }

    private static RowStoreProto.RowFilter.Builder builder() {
        return RowStoreProto.RowFilter.newBuilder();
    }

    // ---------- all or nothing ----------

    public static Filter passAll() {
        return PASS_ALL;
    }

    public static Filter blockAll() {
        return of(builder().setBlockAllFilter(true));
    }

    // ---------- families and columns ----------

    /** Cells of one column family. */
    public static Filter family(String family) {
        Objects.requireNonNull(family, "family");
        return of(builder().setFamilyName(family));
    }

    /** Cells of one column qualifier, in any family. */
    public static Filter column(String qualifier) {
        return column(RowKeys.of(qualifier));
    }

    public static Filter column(ByteString qualifier) {
        Objects.requireNonNull(qualifier, "qualifier");
        return of(builder().setColumnQualifier(qualifier));
    }

    /** Cells whose family name matches {@code pattern}. */
    public static Filter familyRegex(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return of(builder().setFamilyNameRegexFilter(pattern));
    }

    /** Cells whose qualifier matches {@code pattern}. */
    public static Filter columnRegex(String pattern) {
        return of(builder().setColumnQualifierRegexFilter(RowKeys.of(pattern)));
    }

    /** Columns of {@code family} in {@code [start, end)}. */
    public static Filter columnRange(String family, String start, String end) {
        return columnRangeRightOpen(family, start, end);
    }

    public static Filter columnRangeRightOpen(String family, String start, String end) {
        return of(builder().setColumnRangeFilter(columnRangeBuilder(family)
                .setStartQualifierClosed(RowKeys.of(start))
                .setEndQualifierOpen(RowKeys.of(end))));
    }

    public static Filter columnRangeLeftOpen(String family, String start, String end) {
        return of(builder().setColumnRangeFilter(columnRangeBuilder(family)
                .setStartQualifierOpen(RowKeys.of(start))
                .setEndQualifierClosed(RowKeys.of(end))));
    }

    public static Filter columnRangeClosed(String family, String start, String end) {
        return of(builder().setColumnRangeFilter(columnRangeBuilder(family)
                .setStartQualifierClosed(RowKeys.of(start))
                .setEndQualifierClosed(RowKeys.of(end))));
    }

    public static Filter columnRangeOpen(String family, String start, String end) {
        return of(builder().setColumnRangeFilter(columnRangeBuilder(family)
                .setStartQualifierOpen(RowKeys.of(start))
                .setEndQualifierOpen(RowKeys.of(end))));
    }

    private static RowStoreProto.ColumnRange.Builder columnRangeBuilder(String family) {
        Objects.requireNonNull(family, "family");
        return RowStoreProto.ColumnRange.newBuilder().setFamilyName(family);
    }

    // ---------- timestamps ----------

    /** The newest {@code n} cells of each column. */
    public static Filter latest(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be > 0");
        }
        return of(builder().setCellsPerColumnLimit(n));
    }

    /**
     * Cells with a timestamp in {@code [startMicros, endMicros)}.
     * An {@code endMicros} of 0 leaves the range open at the top.
     */
    public static Filter timestampRangeMicros(long startMicros, long endMicros) {
        if (startMicros < 0 || endMicros < 0) {
            throw new IllegalArgumentException("timestamps must be >= 0");
        }
        if (endMicros != 0 && endMicros < startMicros) {
            throw new IllegalArgumentException(
                    "end " + endMicros + " is before start " + startMicros);
        }
        return of(builder().setTimestampRangeFilter(RowStoreProto.TimestampRange.newBuilder()
                .setStartTimestampMicros(startMicros)
                .setEndTimestampMicros(endMicros)));
    }

    public static Filter timestampRange(Instant start, Instant end) {
        return timestampRangeMicros(toMicros(start), toMicros(end));
    }

    private static long toMicros(Instant t) {
        Objects.requireNonNull(t, "instant");
        return Math.addExact(Math.multiplyExact(t.getEpochSecond(), 1_000_000L), t.getNano() / 1_000);
    }

    // ---------- rows ----------

    /** Rows whose key matches {@code pattern}. */
    public static Filter rowKeysRegex(String pattern) {
        return of(builder().setRowKeyRegexFilter(RowKeys.of(pattern)));
    }

    /** Each row independently, with the given probability. */
    public static Filter rowSample(double probability) {
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new IllegalArgumentException("probability must be in [0, 1], got " + probability);
        }
        return of(builder().setRowSampleFilter(probability));
    }

    /** The first {@code n} cells of each row. */
    public static Filter cellsRowLimit(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be > 0");
        }
        return of(builder().setCellsPerRowLimitFilter(n));
    }

    /** Skip the first {@code n} cells of each row. */
    public static Filter cellsRowOffset(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0");
        }
        return of(builder().setCellsPerRowOffsetFilter(n));
    }

    // ---------- values ----------

    /** Cells whose value matches {@code pattern}. */
    public static Filter valueRegex(String pattern) {
        return of(builder().setValueRegexFilter(RowKeys.of(pattern)));
    }

    /** Values in {@code [start, end)}. */
    public static Filter valueRange(String start, String end) {
        return valueRangeRightOpen(start, end);
    }

    public static Filter valueRangeRightOpen(String start, String end) {
        return of(builder().setValueRangeFilter(RowStoreProto.ValueRange.newBuilder()
                .setStartValueClosed(RowKeys.of(start))
                .setEndValueOpen(RowKeys.of(end))));
    }

    public static Filter valueRangeLeftOpen(String start, String end) {
        return of(builder().setValueRangeFilter(RowStoreProto.ValueRange.newBuilder()
                .setStartValueOpen(RowKeys.of(start))
                .setEndValueClosed(RowKeys.of(end))));
    }

    public static Filter valueRangeClosed(String start, String end) {
        return of(builder().setValueRangeFilter(RowStoreProto.ValueRange.newBuilder()
                .setStartValueClosed(RowKeys.of(start))
                .setEndValueClosed(RowKeys.of(end))));
    }

    public static Filter valueRangeOpen(String start, String end) {
        return of(builder().setValueRangeFilter(RowStoreProto.ValueRange.newBuilder()
                .setStartValueOpen(RowKeys.of(start))
                .setEndValueOpen(RowKeys.of(end))));
    }

    // ---------- transformers ----------

    /** Replace every value with the empty value; keys and timestamps stay. */
    public static Filter stripValue() {
        return of(builder().setStripValueTransformer(true));
    }

    /**
     * Attach {@code label} to every cell. Labels are 1 to 15 characters of
     * {@code [a-z0-9-]}; the server rejects anything else.
     */
    public static Filter applyLabel(String label) {
        Objects.requireNonNull(label, "label");
        return of(builder().setApplyLabelTransformer(label));
    }

    // ---------- composition ----------

    /** Apply filters one after another; a cell must pass all of them. */
    public static Filter chain(Filter... filters) {
        var c = RowStoreProto.RowFilter.Chain.newBuilder();
        for (var f : filters) {
            c.addFilters(f.proto);
        }
        return of(builder().setChain(c));
    }

    /**
     * Run every filter on the same input and merge their outputs in cell order.
     * A cell passed by two filters appears twice.
     */
    public static Filter interleave(Filter... filters) {
        var i = RowStoreProto.RowFilter.Interleave.newBuilder();
        for (var f : filters) {
            i.addFilters(f.proto);
        }
        return of(builder().setInterleave(i));
    }

    /**
     * {@code ifMatched} applied to the row when {@code predicate} yields any of
     * its cells, {@code otherwise} when it yields none.
     */
    public static Filter condition(Filter predicate, Filter ifMatched, Filter otherwise) {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(ifMatched, "ifMatched");
        Objects.requireNonNull(otherwise, "otherwise");
        return of(builder().setCondition(RowStoreProto.RowFilter.Condition.newBuilder()
                .setPredicateFilter(predicate.proto)
                .setTrueFilter(ifMatched.proto)
                .setFalseFilter(otherwise.proto)));
    }

    public RowStoreProto.RowFilter toProto() {
        return proto;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Filter other)) return false;
        return proto.equals(other.proto);
    }

    @Override
    public int hashCode() {
        return proto.hashCode();
    }

    @Override
    public String toString() {
        return "Filter{" + proto.toString().trim().replace('\n', ' ') + "}";
    }
}
