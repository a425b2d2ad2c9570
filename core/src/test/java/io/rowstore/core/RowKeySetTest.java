// file: core/src/test/java/io/rowstore/core/RowKeySetTest.java
package io.rowstore.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.rowstore.core.RowKeys.of;
import static org.junit.jupiter.api.Assertions.*;

class RowKeySetTest {

    @Test
    void empty_set_means_all_rows_and_intersects_to_the_range() {
        var s = RowKeySet.all();
        assertTrue(s.isAllRows());
        assertFalse(s.isEmpty());

        s.intersect(RowKeyRange.after(of("r1")));
        assertEquals(List.of(RowKeyRange.after(of("r1"))), s.ranges());
        assertTrue(s.contains(of("r2")));
        assertFalse(s.contains(of("r1")));
    }

    @Test
    void intersect_filters_keys_and_ranges() {
        var s = RowKeySet.of("a", "c", "e")
                .append(RowKeyRange.range(of("f"), of("h")))
                .append(RowKeyRange.range(of("0"), of("b")));

        s.intersect(RowKeyRange.after(of("c")));

        assertEquals(List.of(of("e")), s.keys());
        assertEquals(List.of(RowKeyRange.range(of("f"), of("h"))), s.ranges());
        assertFalse(s.isEmpty());
    }

    @Test
    void intersect_to_nothing_becomes_empty_not_all_rows() {
        var s = RowKeySet.of(RowKeyRange.closed(of("r1"), of("r2")));
        s.intersect(RowKeyRange.after(of("r2")));

        assertTrue(s.isEmpty());
        assertFalse(s.isAllRows());
        assertFalse(s.contains(of("r3")));
    }

    @Test
    void copy_is_independent() {
        var s = RowKeySet.of("a", "b");
        var c = s.copy();
        c.intersect(RowKeyRange.after(of("a")));
        assertEquals(2, s.keys().size());
        assertEquals(1, c.keys().size());
    }

    @Test
    void proto_form_round_trips_keys_and_ranges() {
        var s = RowKeySet.of("k1").append(RowKeyRange.prefix(of("p/")));
        var back = RowKeySet.fromProto(s.toProto());
        assertEquals(s.keys(), back.keys());
        assertEquals(s.ranges(), back.ranges());
    }
}
