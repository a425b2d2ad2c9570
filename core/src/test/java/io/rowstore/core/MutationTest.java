// file: core/src/test/java/io/rowstore/core/MutationTest.java
package io.rowstore.core;

import io.rowstore.proto.RowStoreProto;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MutationTest {

    @Test
    void server_timestamp_is_flagged_only_for_set_cell() {
        assertTrue(Mutation.setCell("fam", "col", "v").hasServerAssignedTimestamp());
        assertFalse(Mutation.setCell("fam", "col", 0, "v").hasServerAssignedTimestamp());
        assertFalse(Mutation.deleteFromColumn("fam", "col").hasServerAssignedTimestamp());
        assertFalse(Mutation.deleteFromFamily("fam").hasServerAssignedTimestamp());
        assertFalse(Mutation.deleteFromRow().hasServerAssignedTimestamp());
    }

    @Test
    void wire_form_carries_every_field() {
        var m = Mutation.deleteFromColumn("fam", "col", 10, 20);
        RowStoreProto.Mutation p = m.toProto();
        assertEquals(RowStoreProto.Mutation.MutationCase.DELETE_FROM_COLUMN, p.getMutationCase());
        assertEquals(10, p.getDeleteFromColumn().getTimeRange().getStartTimestampMicros());
        assertEquals(20, p.getDeleteFromColumn().getTimeRange().getEndTimestampMicros());
        assertEquals(m, Mutation.fromProto(p));
    }

    @Test
    void invalid_arguments_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Mutation.setCell("", "col", 0, "v"));
        assertThrows(IllegalArgumentException.class, () -> Mutation.setCell("fam", "col", -2, "v"));
        assertThrows(IllegalArgumentException.class, () -> Mutation.deleteFromColumn("fam", "col", 20, 10));
        assertThrows(IllegalArgumentException.class,
                () -> Mutation.fromProto(RowStoreProto.Mutation.getDefaultInstance()));
        assertThrows(IllegalArgumentException.class, () -> SingleRowMutation.of(""));
    }
}
