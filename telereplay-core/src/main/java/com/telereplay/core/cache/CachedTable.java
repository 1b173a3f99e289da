package com.telereplay.core.cache;

import com.telereplay.core.model.Row;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable, timestamp-ordered sequence of rows of one topic.
 * <p>
 * Timestamps are strictly increasing. Merging produces a new table, so a
 * reader holding a reference never sees a partially merged state.
 */
public final class CachedTable {
    private static final CachedTable EMPTY = new CachedTable(List.of());

    private final List<Row> rows;

    private CachedTable(List<Row> rows) {
        this.rows = rows;
    }

    public static CachedTable empty() {
        return EMPTY;
    }

    /**
     * Create a table from rows sorted by timestamp.
     *
     * @throws IllegalStateException if timestamps are not strictly increasing
     */
    public static CachedTable of(List<Row> rows) {
        if (rows.isEmpty()) {
            return EMPTY;
        }
        List<Row> copy = List.copyOf(rows);
        checkOrdered(copy, 0);
        return new CachedTable(copy);
    }

    private static void checkOrdered(List<Row> rows, int from) {
        for (int i = Math.max(1, from); i < rows.size(); i++) {
            Instant previous = rows.get(i - 1).timestamp();
            Instant current = rows.get(i).timestamp();
            if (!current.isAfter(previous)) {
                throw new IllegalStateException("Rows not strictly increasing at index " + i
                    + ": " + previous + " followed by " + current);
            }
        }
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public Row get(int index) {
        return rows.get(index);
    }

    public List<Row> getRows() {
        return rows;
    }

    /**
     * Timestamp of the first row, or null if empty.
     */
    public Instant getStart() {
        return rows.isEmpty() ? null : rows.get(0).timestamp();
    }

    /**
     * Timestamp of the last row, or null if empty.
     */
    public Instant getEnd() {
        return rows.isEmpty() ? null : rows.get(rows.size() - 1).timestamp();
    }

    /**
     * Last row with timestamp at or before the given time, or null.
     */
    public Row floor(Instant time) {
        int low = 0;
        int high = rows.size() - 1;
        Row found = null;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            Row row = rows.get(mid);
            if (row.timestamp().isAfter(time)) {
                high = mid - 1;
            } else {
                found = row;
                low = mid + 1;
            }
        }
        return found;
    }

    /**
     * Combine with a table that lies entirely after or entirely before this one.
     * A single row shared at the touching boundary is kept once.
     *
     * @throws IllegalStateException if the tables interleave
     */
    public CachedTable merge(CachedTable other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;

        if (!other.getStart().isBefore(getEnd())) {
            int skip = other.getStart().equals(getEnd()) ? 1 : 0;
            return concat(rows, other.rows.subList(skip, other.rows.size()));
        }
        if (!other.getEnd().isAfter(getStart())) {
            int keep = other.getEnd().equals(getStart()) ? other.rows.size() - 1 : other.rows.size();
            return concat(other.rows.subList(0, keep), rows);
        }
        throw new IllegalStateException("Cannot merge overlapping tables: ["
            + getStart() + ", " + getEnd() + "] and [" + other.getStart() + ", " + other.getEnd() + "]");
    }

    private static CachedTable concat(List<Row> head, List<Row> tail) {
        if (tail.isEmpty()) return head.isEmpty() ? EMPTY : new CachedTable(head);
        if (head.isEmpty()) return new CachedTable(tail);
        List<Row> merged = new ArrayList<>(head.size() + tail.size());
        merged.addAll(head);
        merged.addAll(tail);
        checkOrdered(merged, head.size());
        return new CachedTable(Collections.unmodifiableList(merged));
    }

    @Override
    public String toString() {
        if (rows.isEmpty()) return "CachedTable[]";
        return "CachedTable[" + rows.size() + " rows, " + getStart() + " - " + getEnd() + "]";
    }
}
