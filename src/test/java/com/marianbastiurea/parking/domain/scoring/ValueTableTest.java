package com.marianbastiurea.parking.domain.scoring;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueTableTest {

    @Test
    void unsetEntriesKeepTheDefault() {
        ValueTable table = ValueTable.builder(3, 4, -1.0).set(1, 2, 0.5).build();

        assertEquals(0.5, table.value(1, 2));
        assertEquals(-1.0, table.value(0, 0));
        assertEquals(3, table.states());
        assertEquals(4, table.actions());
    }

    @Test
    void builtTableIsNotChangedByLaterBuilderWrites() {
        ValueTable.Builder builder = ValueTable.builder(2, 2, 0.0).set(0, 0, 1.0);
        ValueTable table = builder.build();

        builder.set(0, 0, 9.0).set(1, 1, 9.0);

        assertEquals(1.0, table.value(0, 0));
        assertEquals(0.0, table.value(1, 1));
    }

    @Test
    void outOfRangeIndicesAreRejected() {
        ValueTable table = ValueTable.constant(2, 2, 0.0);

        assertThrows(IllegalArgumentException.class, () -> table.value(2, 0));
        assertThrows(IllegalArgumentException.class, () -> table.value(0, -1));
        assertThrows(IllegalArgumentException.class, () -> ValueTable.builder(2, 2, 0.0).set(0, 5, 1.0));
        assertThrows(IllegalArgumentException.class, () -> ValueTable.builder(0, 2, 0.0));
    }
}
