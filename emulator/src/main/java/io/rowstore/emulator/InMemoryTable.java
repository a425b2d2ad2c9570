// file: emulator/src/main/java/io/rowstore/emulator/InMemoryTable.java
package io.rowstore.emulator;

import com.google.protobuf.ByteString;
import io.rowstore.core.Cell;
import io.rowstore.core.Mutation;
import io.rowstore.core.Row;
import io.rowstore.core.RowKeySample;
import io.rowstore.core.RowKeySet;
import io.rowstore.core.RowKeys;
import io.rowstore.proto.RowStoreProto;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * One table of the emulator, held entirely in memory.
 * <p>
 * Layout: row key -> family -> qualifier -> timestamp (newest first) -> value.
 * Row keys and qualifiers sort as unsigned bytes, families as strings.
 * <p>
 * Responsibilities:
 *  - Apply the mutations of one row atomically (validate all, then apply all).
 *  - Stamp SetCell mutations that ask for a server timestamp.
 *  - Answer reads over a row set with a filter and an optional rows limit.
 *  - Run check-and-mutate: evaluate a predicate filter on one row and apply
 *    one of two mutation lists, under the same lock.
 *  - Sample row keys that split the table into chunks of similar byte size.
 * <p>
 * Thread safe: every public method locks the table.
 */
public final class InMemoryTable {
    private static final Logger log = Logger.getLogger(InMemoryTable.class.getName());

    private static final Pattern LABEL = Pattern.compile("[a-z0-9-]{1,15}");

    /** Family, then qualifier (unsigned), then newest timestamp first. */
    static final Comparator<Cell> CELL_ORDER = Comparator.comparing(Cell::family)
            .thenComparing(Cell::qualifier, RowKeys.order())
            .thenComparing(Comparator.comparingLong(Cell::timestampMicros).reversed());

    private final String name;
    private final Clock clock;
    private final NavigableMap<ByteString, NavigableMap<String, NavigableMap<ByteString, NavigableMap<Long, ByteString>>>>
            rows = new TreeMap<>(RowKeys.order());

    public InMemoryTable(String name) {
        this(name, Clock.systemUTC());
    }

    public InMemoryTable(String name, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String name() {
        return name;
    }

    // ---------- writes ----------

    /**
     * Apply all {@code mutations} to one row, or none of them.
     *
     * @throws IllegalArgumentException on an empty row key or an unsupported mutation
     */
    public synchronized void apply(ByteString rowKey, List<Mutation> mutations) {
        Objects.requireNonNull(rowKey, "rowKey");
        if (rowKey.isEmpty()) {
            throw new IllegalArgumentException("row key must not be empty");
        }
        for (var m : mutations) {
            if (!(m instanceof Mutation.SetCell
                    || m instanceof Mutation.DeleteFromColumn
                    || m instanceof Mutation.DeleteFromFamily
                    || m instanceof Mutation.DeleteFromRow)) {
                throw new IllegalArgumentException("unsupported mutation: " + m);
            }
        }

        long serverMicros = clock.millis() * 1000L;
        var row = rows.computeIfAbsent(rowKey, k -> new TreeMap<>());
        for (var m : mutations) {
            if (m instanceof Mutation.SetCell s) {
                long ts = s.hasServerAssignedTimestamp() ? serverMicros : s.timestampMicros();
                row.computeIfAbsent(s.family(), f -> new TreeMap<>(RowKeys.order()))
                        .computeIfAbsent(s.qualifier(), q -> new TreeMap<>(Comparator.reverseOrder()))
                        .put(ts, s.value());
            } else if (m instanceof Mutation.DeleteFromColumn d) {
                var family = row.get(d.family());
                var column = family == null ? null : family.get(d.qualifier());
                if (column != null) {
                    column.keySet().removeIf(ts -> inTimeRange(ts, d.startMicros(), d.endMicros()));
                    if (column.isEmpty()) {
                        family.remove(d.qualifier());
                    }
                    if (family.isEmpty()) {
                        row.remove(d.family());
                    }
                }
            } else if (m instanceof Mutation.DeleteFromFamily d) {
                row.remove(d.family());
            } else {
                row.clear();
            }
        }
        if (row.isEmpty()) {
            rows.remove(rowKey);
        }
        log.fine(() -> "table " + name + ": applied " + mutations.size()
                + " mutation(s) to " + RowKeys.debugString(rowKey));
    }

    private static boolean inTimeRange(long ts, long startMicros, long endMicros) {
        return (startMicros == 0 || ts >= startMicros) && (endMicros == 0 || ts < endMicros);
    }

    /**
     * Apply {@code ifMatched} when {@code predicate} yields any cell of the row,
     * {@code otherwise} when it yields none (or the row does not exist).
     *
     * @return whether the predicate matched
     * @throws IllegalArgumentException on an empty row key, two empty lists, a bad filter or mutation
     */
    public synchronized boolean checkAndMutate(
            ByteString rowKey,
            RowStoreProto.RowFilter predicate,
            List<Mutation> ifMatched,
            List<Mutation> otherwise
    ) {
        Objects.requireNonNull(rowKey, "rowKey");
        if (rowKey.isEmpty()) {
            throw new IllegalArgumentException("row key must not be empty");
        }
        if (ifMatched.isEmpty() && otherwise.isEmpty()) {
            throw new IllegalArgumentException("true and false mutations are both empty");
        }
        var row = rows.get(rowKey);
        boolean matched = row != null && !applyFilter(predicate, flatten(rowKey, row)).isEmpty();
        List<Mutation> chosen = matched ? ifMatched : otherwise;
        if (!chosen.isEmpty()) {
            apply(rowKey, chosen);
        }
        log.fine(() -> "table " + name + ": predicate on " + RowKeys.debugString(rowKey)
                + (matched ? " matched" : " did not match"));
        return matched;
    }

    // ---------- reads ----------

    /**
     * Rows selected by {@code rowSet}, in key order, with {@code filter} applied.
     * Rows left without cells by the filter are skipped. {@code rowsLimit} of 0 means no limit.
     */
    public synchronized List<Row> read(RowKeySet rowSet, RowStoreProto.RowFilter filter, long rowsLimit) {
        List<Row> out = new ArrayList<>();
        for (var e : rows.entrySet()) {
            if (rowsLimit > 0 && out.size() >= rowsLimit) {
                break;
            }
            if (!rowSet.contains(e.getKey())) {
                continue;
            }
            List<Cell> cells = applyFilter(filter, flatten(e.getKey(), e.getValue()));
            if (!cells.isEmpty()) {
                out.add(new Row(e.getKey(), cells));
            }
        }
        return out;
    }

    public synchronized int rowCount() {
        return rows.size();
    }

    /**
     * Row keys splitting the table into runs of about {@code intervalBytes}
     * bytes each, with the bytes stored before each key. The last sample has
     * an empty key and the size of the whole table.
     */
    public synchronized List<RowKeySample> sampleRowKeys(long intervalBytes) {
        if (intervalBytes <= 0) {
            throw new IllegalArgumentException("intervalBytes must be > 0");
        }
        List<RowKeySample> out = new ArrayList<>();
        long offset = 0;
        long next = intervalBytes;
        for (var e : rows.entrySet()) {
            if (offset >= next) {
                out.add(new RowKeySample(e.getKey(), offset));
                next = offset + intervalBytes;
            }
            offset += rowBytes(e.getKey(), e.getValue());
        }
        out.add(new RowKeySample(ByteString.EMPTY, offset));
        return out;
    }

    private static long rowBytes(
            ByteString rowKey,
            Map<String, NavigableMap<ByteString, NavigableMap<Long, ByteString>>> row
    ) {
        long total = rowKey.size();
        for (var family : row.entrySet()) {
            total += family.getKey().getBytes(StandardCharsets.UTF_8).length;
            for (var column : family.getValue().entrySet()) {
                total += column.getKey().size();
                for (ByteString value : column.getValue().values()) {
                    total += Long.BYTES + value.size();
                }
            }
        }
        return total;
    }

    private static List<Cell> flatten(
            ByteString rowKey,
            Map<String, NavigableMap<ByteString, NavigableMap<Long, ByteString>>> row
    ) {
        List<Cell> cells = new ArrayList<>();
        row.forEach((family, columns) -> columns.forEach((qualifier, versions) ->
                versions.forEach((ts, value) ->
                        cells.add(new Cell(rowKey, family, qualifier, ts, value, List.of())))));
        return cells;
    }

    /**
     * Evaluate a filter over the cells of one row, ordered by {@link #CELL_ORDER}.
     *
     * @throws IllegalArgumentException on an invalid filter (bad regex, limit or label)
     */
    static List<Cell> applyFilter(RowStoreProto.RowFilter filter, List<Cell> cells) {
        if (cells.isEmpty()) {
            return cells;
        }
        return switch (filter.getFilterCase()) {
            case FILTER_NOT_SET -> cells;
            case PASS_ALL_FILTER -> filter.getPassAllFilter() ? cells : List.of();
            case BLOCK_ALL_FILTER -> filter.getBlockAllFilter() ? List.of() : cells;
            case FAMILY_NAME -> keep(cells, c -> c.family().equals(filter.getFamilyName()));
            case COLUMN_QUALIFIER -> keep(cells, c -> c.qualifier().equals(filter.getColumnQualifier()));
            case CELLS_PER_COLUMN_LIMIT -> latestPerColumn(cells, filter.getCellsPerColumnLimit());
            case CHAIN -> {
                List<Cell> current = cells;
                for (var f : filter.getChain().getFiltersList()) {
                    current = applyFilter(f, current);
                }
                yield current;
            }
            case INTERLEAVE -> {
                List<Cell> merged = new ArrayList<>();
                for (var f : filter.getInterleave().getFiltersList()) {
                    merged.addAll(applyFilter(f, cells));
                }
                merged.sort(CELL_ORDER);
                yield merged;
            }
            case CONDITION -> {
                var c = filter.getCondition();
                boolean matched = !applyFilter(c.getPredicateFilter(), cells).isEmpty();
                if (matched) {
                    yield c.hasTrueFilter() ? applyFilter(c.getTrueFilter(), cells) : List.of();
                }
                yield c.hasFalseFilter() ? applyFilter(c.getFalseFilter(), cells) : List.of();
            }
            case FAMILY_NAME_REGEX_FILTER -> {
                Pattern p = Pattern.compile(filter.getFamilyNameRegexFilter());
                yield keep(cells, c -> p.matcher(c.family()).matches());
            }
            case COLUMN_QUALIFIER_REGEX_FILTER -> {
                Pattern p = bytePattern(filter.getColumnQualifierRegexFilter());
                yield keep(cells, c -> matches(p, c.qualifier()));
            }
            case ROW_KEY_REGEX_FILTER -> {
                Pattern p = bytePattern(filter.getRowKeyRegexFilter());
                yield matches(p, cells.get(0).rowKey()) ? cells : List.of();
            }
            case VALUE_REGEX_FILTER -> {
                Pattern p = bytePattern(filter.getValueRegexFilter());
                yield keep(cells, c -> matches(p, c.value()));
            }
            case COLUMN_RANGE_FILTER -> {
                var r = filter.getColumnRangeFilter();
                yield keep(cells, c -> c.family().equals(r.getFamilyName()) && inColumnRange(r, c.qualifier()));
            }
            case TIMESTAMP_RANGE_FILTER -> {
                var r = filter.getTimestampRangeFilter();
                yield keep(cells, c -> inTimeRange(
                        c.timestampMicros(), r.getStartTimestampMicros(), r.getEndTimestampMicros()));
            }
            case VALUE_RANGE_FILTER -> keep(cells, c -> inValueRange(filter.getValueRangeFilter(), c.value()));
            case ROW_SAMPLE_FILTER -> {
                double p = filter.getRowSampleFilter();
                if (!(p >= 0.0 && p <= 1.0)) {
                    throw new IllegalArgumentException("row_sample_filter must be in [0, 1], got " + p);
                }
                yield ThreadLocalRandom.current().nextDouble() < p ? cells : List.of();
            }
            case CELLS_PER_ROW_OFFSET_FILTER -> {
                int n = filter.getCellsPerRowOffsetFilter();
                if (n < 0) {
                    throw new IllegalArgumentException("cells_per_row_offset_filter must be >= 0, got " + n);
                }
                yield n >= cells.size() ? List.of() : cells.subList(n, cells.size());
            }
            case CELLS_PER_ROW_LIMIT_FILTER -> {
                int n = filter.getCellsPerRowLimitFilter();
                if (n <= 0) {
                    throw new IllegalArgumentException("cells_per_row_limit_filter must be > 0, got " + n);
                }
                yield cells.subList(0, Math.min(n, cells.size()));
            }
            case STRIP_VALUE_TRANSFORMER -> filter.getStripValueTransformer()
                    ? cells.stream().map(c -> withValue(c, ByteString.EMPTY)).toList()
                    : cells;
            case APPLY_LABEL_TRANSFORMER -> {
                String label = filter.getApplyLabelTransformer();
                if (!LABEL.matcher(label).matches()) {
                    throw new IllegalArgumentException("label must match [a-z0-9-]{1,15}, got '" + label + "'");
                }
                yield cells.stream().map(c -> withLabel(c, label)).toList();
            }
        };
    }

    private static List<Cell> keep(List<Cell> cells, Predicate<Cell> test) {
        return cells.stream().filter(test).toList();
    }

    // byte patterns see one char per byte, so they match raw bytes
    private static Pattern bytePattern(ByteString regex) {
        return Pattern.compile(regex.toString(StandardCharsets.ISO_8859_1), Pattern.DOTALL);
    }

    private static boolean matches(Pattern p, ByteString subject) {
        return p.matcher(subject.toString(StandardCharsets.ISO_8859_1)).matches();
    }

    private static boolean inColumnRange(RowStoreProto.ColumnRange r, ByteString q) {
        boolean startOk = switch (r.getStartQualifierCase()) {
            case START_QUALIFIER_CLOSED -> RowKeys.compare(q, r.getStartQualifierClosed()) >= 0;
            case START_QUALIFIER_OPEN -> RowKeys.compare(q, r.getStartQualifierOpen()) > 0;
            case STARTQUALIFIER_NOT_SET -> true;
        };
        boolean endOk = switch (r.getEndQualifierCase()) {
            case END_QUALIFIER_CLOSED -> RowKeys.compare(q, r.getEndQualifierClosed()) <= 0;
            case END_QUALIFIER_OPEN -> RowKeys.compare(q, r.getEndQualifierOpen()) < 0;
            case ENDQUALIFIER_NOT_SET -> true;
        };
        return startOk && endOk;
    }

    private static boolean inValueRange(RowStoreProto.ValueRange r, ByteString v) {
        boolean startOk = switch (r.getStartValueCase()) {
            case START_VALUE_CLOSED -> RowKeys.compare(v, r.getStartValueClosed()) >= 0;
            case START_VALUE_OPEN -> RowKeys.compare(v, r.getStartValueOpen()) > 0;
            case STARTVALUE_NOT_SET -> true;
        };
        boolean endOk = switch (r.getEndValueCase()) {
            case END_VALUE_CLOSED -> RowKeys.compare(v, r.getEndValueClosed()) <= 0;
            case END_VALUE_OPEN -> RowKeys.compare(v, r.getEndValueOpen()) < 0;
            case ENDVALUE_NOT_SET -> true;
        };
        return startOk && endOk;
    }

    private static Cell withValue(Cell c, ByteString value) {
        return new Cell(c.rowKey(), c.family(), c.qualifier(), c.timestampMicros(), value, c.labels());
    }

    private static Cell withLabel(Cell c, String label) {
        List<String> labels = new ArrayList<>(c.labels());
        labels.add(label);
        return new Cell(c.rowKey(), c.family(), c.qualifier(), c.timestampMicros(), c.value(), labels);
    }

    private static List<Cell> latestPerColumn(List<Cell> cells, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("cells_per_column_limit must be > 0, got " + limit);
        }
        List<Cell> out = new ArrayList<>();
        String family = null;
        ByteString qualifier = null;
        int seen = 0;
        for (var c : cells) {
            if (!c.family().equals(family) || !c.qualifier().equals(qualifier)) {
                family = c.family();
                qualifier = c.qualifier();
                seen = 0;
            }
            if (seen++ < limit) {
                out.add(c);
            }
        }
        return out;
    }
}
