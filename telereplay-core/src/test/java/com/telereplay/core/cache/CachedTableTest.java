package com.telereplay.core.cache;

import com.telereplay.core.model.Row;
import com.telereplay.core.testutils.FakeArchiveClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CachedTableTest {

    private static Instant ms(long millis) {
        return Instant.ofEpochMilli(millis);
    }

    @Test
    @DisplayName("Empty table has no bounds")
    void emptyTable() {
        CachedTable table = CachedTable.of(List.of());

        assertTrue(table.isEmpty());
        assertNull(table.getStart());
        assertNull(table.getEnd());
        assertNull(table.floor(ms(1000)));
    }

    @Test
    @DisplayName("Bounds are the first and last timestamps")
    void bounds() {
        CachedTable table = CachedTable.of(FakeArchiveClient.rows(ms(1000), ms(2000), Duration.ofMillis(100)));

        assertEquals(10, table.size());
        assertEquals(ms(1000), table.getStart());
        assertEquals(ms(1900), table.getEnd());
    }

    @Test
    @DisplayName("Duplicate or decreasing timestamps are rejected")
    void rejectsUnorderedRows() {
        Row a = FakeArchiveClient.row(ms(1000));
        Row b = FakeArchiveClient.row(ms(2000));

        assertThrows(IllegalStateException.class, () -> CachedTable.of(List.of(a, a)));
        assertThrows(IllegalStateException.class, () -> CachedTable.of(List.of(b, a)));
    }

    @Test
    @DisplayName("Floor finds the last row at or before a time")
    void floor() {
        CachedTable table = CachedTable.of(FakeArchiveClient.rows(ms(1000), ms(2000), Duration.ofMillis(100)));

        assertNull(table.floor(ms(999)));
        assertEquals(ms(1000), table.floor(ms(1000)).timestamp());
        assertEquals(ms(1400), table.floor(ms(1499)).timestamp());
        assertEquals(ms(1900), table.floor(ms(5000)).timestamp());
    }

    @Test
    @DisplayName("Merge leaves both inputs untouched")
    void mergeIsCopyOnWrite() {
        CachedTable left = CachedTable.of(FakeArchiveClient.rows(ms(0), ms(1000), Duration.ofMillis(100)));
        CachedTable right = CachedTable.of(FakeArchiveClient.rows(ms(1000), ms(2000), Duration.ofMillis(100)));

        CachedTable merged = left.merge(right);

        assertEquals(20, merged.size());
        assertEquals(10, left.size());
        assertEquals(10, right.size());
        assertEquals(merged.getRows(), right.merge(left).getRows(), "Merge order does not matter for disjoint tables");
    }

    @Test
    @DisplayName("Single shared boundary row merges into the existing table without growth")
    void singleDuplicateRow() {
        CachedTable table = CachedTable.of(FakeArchiveClient.rows(ms(0), ms(1000), Duration.ofMillis(100)));
        CachedTable duplicate = CachedTable.of(List.of(FakeArchiveClient.row(ms(900))));

        assertEquals(10, table.merge(duplicate).size());
    }
}
