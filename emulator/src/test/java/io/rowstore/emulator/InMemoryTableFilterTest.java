// file: emulator/src/test/java/io/rowstore/emulator/InMemoryTableFilterTest.java
package io.rowstore.emulator;

import io.rowstore.core.Cell;
import io.rowstore.core.Filter;
import io.rowstore.core.Mutation;
import io.rowstore.core.Row;
import io.rowstore.core.RowKeySet;
import io.rowstore.core.RowKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Filter evaluation over one row holding, in cell order:
 *   a:x@3=v1, a:x@1=v2, a:y@2=v3, b:z@2=w
 */
class InMemoryTableFilterTest {

    private InMemoryTable table;

    @BeforeEach
    void setUp() {
        table = new InMemoryTable("t", Clock.fixed(Instant.ofEpochMilli(1), ZoneOffset.UTC));
        table.apply(RowKeys.of("r"), List.of(
                Mutation.setCell("b", "z", 2, "w"),
                Mutation.setCell("a", "y", 2, "v3"),
                Mutation.setCell("a", "x", 1, "v2"),
                Mutation.setCell("a", "x", 3, "v1")));
    }

    private List<Cell> read(Filter filter) {
        List<Row> rows = table.read(RowKeySet.of("r"), filter.toProto(), 0);
        return rows.isEmpty() ? List.of() : rows.get(0).cells();
    }

    // "family:qualifier@timestamp" per cell
    private List<String> cells(Filter filter) {
        return read(filter).stream()
                .map(c -> c.family() + ":" + c.qualifier().toStringUtf8() + "@" + c.timestampMicros())
                .toList();
    }

    @Test
    void cells_come_back_in_family_qualifier_newest_first_order() {
        assertEquals(List.of("a:x@3", "a:x@1", "a:y@2", "b:z@2"), cells(Filter.passAll()));
    }

    @Test
    void regex_filters_must_match_the_whole_target() {
        assertEquals(3, cells(Filter.familyRegex("a")).size());
        assertEquals(4, cells(Filter.familyRegex("a|b")).size());
        assertTrue(cells(Filter.familyRegex("")).isEmpty());

        assertEquals(List.of("a:x@3", "a:x@1"), cells(Filter.columnRegex("x")));
        assertEquals(3, cells(Filter.columnRegex("[xy]")).size());

        assertEquals(4, cells(Filter.rowKeysRegex("r")).size());
        assertTrue(cells(Filter.rowKeysRegex("r.+")).isEmpty());

        assertEquals(3, cells(Filter.valueRegex("v.")).size());
        assertEquals(List.of("b:z@2"), cells(Filter.valueRegex("w")));
    }

    @Test
    void malformed_regex_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> cells(Filter.familyRegex("(")));
        assertThrows(IllegalArgumentException.class, () -> cells(Filter.valueRegex("[")));
    }

    @Test
    void column_range_honours_each_bound_shape() {
        assertEquals(List.of("a:x@3", "a:x@1"), cells(Filter.columnRange("a", "x", "y")));
        assertEquals(3, cells(Filter.columnRangeClosed("a", "x", "y")).size());
        assertEquals(List.of("a:y@2"), cells(Filter.columnRangeLeftOpen("a", "x", "y")));
        assertTrue(cells(Filter.columnRangeOpen("a", "x", "y")).isEmpty());
        // other families never match
        assertTrue(cells(Filter.columnRangeClosed("c", "x", "z")).isEmpty());
    }

    @Test
    void timestamp_range_is_half_open_and_zero_end_is_unbounded() {
        assertEquals(List.of("a:y@2", "b:z@2"), cells(Filter.timestampRangeMicros(2, 3)));
        assertEquals(List.of("a:x@3", "a:y@2", "b:z@2"), cells(Filter.timestampRangeMicros(2, 0)));
    }

    @Test
    void value_range_honours_each_bound_shape() {
        assertEquals(List.of("a:x@3", "a:x@1"), cells(Filter.valueRange("v1", "v3")));
        assertEquals(3, cells(Filter.valueRangeClosed("v1", "v3")).size());
        assertEquals(List.of("a:x@1"), cells(Filter.valueRangeOpen("v1", "v3")));
        assertEquals(List.of("a:x@1", "a:y@2"), cells(Filter.valueRangeLeftOpen("v1", "v3")));
    }

    @Test
    void row_limit_and_offset_count_cells_across_columns() {
        assertEquals(List.of("a:x@3", "a:x@1"), cells(Filter.cellsRowLimit(2)));
        assertEquals(List.of("b:z@2"), cells(Filter.cellsRowOffset(3)));
        assertTrue(cells(Filter.cellsRowOffset(10)).isEmpty());
    }

    @Test
    void row_sample_keeps_everything_or_nothing_at_the_extremes() {
        assertEquals(4, cells(Filter.rowSample(1.0)).size());
        assertTrue(cells(Filter.rowSample(0.0)).isEmpty());
    }

    @Test
    void strip_value_keeps_keys_and_timestamps() {
        List<Cell> stripped = read(Filter.stripValue());
        assertEquals(4, stripped.size());
        assertTrue(stripped.stream().allMatch(c -> c.value().isEmpty()));
        assertEquals(3, stripped.get(0).timestampMicros());
    }

    @Test
    void apply_label_tags_every_cell_and_rejects_bad_labels() {
        List<Cell> labelled = read(Filter.applyLabel("hot-1"));
        assertTrue(labelled.stream().allMatch(c -> c.labels().equals(List.of("hot-1"))));

        assertThrows(IllegalArgumentException.class, () -> read(Filter.applyLabel("Hot")));
        assertThrows(IllegalArgumentException.class, () -> read(Filter.applyLabel("")));
        assertThrows(IllegalArgumentException.class, () -> read(Filter.applyLabel("a-very-long-label")));
    }

    @Test
    void chain_feeds_each_filter_the_output_of_the_previous() {
        assertEquals(List.of("a:x@3", "a:y@2"), cells(Filter.chain(Filter.family("a"), Filter.latest(1))));
        assertEquals(List.of("a:x@1"), cells(Filter.chain(Filter.family("a"), Filter.cellsRowOffset(1),
                Filter.cellsRowLimit(1))));
    }

    @Test
    void interleave_merges_in_cell_order_and_keeps_duplicates() {
        assertEquals(List.of("a:x@3", "a:x@1", "b:z@2"),
                cells(Filter.interleave(Filter.family("b"), Filter.column("x"))));
        assertEquals(List.of("a:x@3", "a:x@1", "a:y@2", "b:z@2", "b:z@2"),
                cells(Filter.interleave(Filter.passAll(), Filter.family("b"))));
        assertTrue(cells(Filter.interleave()).isEmpty());
    }

    @Test
    void condition_picks_a_branch_on_whether_the_predicate_yields_cells() {
        assertEquals(List.of("b:z@2"),
                cells(Filter.condition(Filter.column("y"), Filter.family("b"), Filter.blockAll())));
        assertEquals(List.of("a:x@3"),
                cells(Filter.condition(Filter.column("nope"), Filter.family("b"), Filter.cellsRowLimit(1))));
    }

    @Test
    void labels_survive_interleave_and_condition() {
        Filter labelled = Filter.chain(Filter.family("b"), Filter.applyLabel("b-side"));
        List<Cell> out = read(Filter.condition(Filter.passAll(), labelled, Filter.blockAll()));
        assertEquals(1, out.size());
        assertEquals(List.of("b-side"), out.get(0).labels());
    }
}
