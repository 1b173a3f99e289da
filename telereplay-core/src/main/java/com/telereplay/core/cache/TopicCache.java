package com.telereplay.core.cache;

import com.telereplay.core.model.Row;
import com.telereplay.core.model.TimeRange;
import com.telereplay.core.model.TopicKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cached rows of a single archived topic.
 *
 * Holds the accumulated table, the interval already fetched from the archive
 * (coverage) and the row that is current at the last evaluated playback time.
 * Rows and coverage are only changed by the fetch holding {@link #getLock()};
 * both are replaced atomically, so readers always see a consistent table.
 */
public class TopicCache {
    /** Fetch starts this much before the requested time, absorbing sample timing jitter */
    public static final Duration LEAD_MARGIN = Duration.ofMillis(50);

    private final String name;
    private final TopicKind kind;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile CachedTable table = CachedTable.empty();
    private volatile TimeRange coverage;
    private volatile Row current;
    // Guarded by this, together with the writes to current
    private Instant currentTime;

    public TopicCache(String name, TopicKind kind) {
        this.name = name;
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public TopicKind getKind() {
        return kind;
    }

    /**
     * Gate serializing fetches that extend this topic.
     */
    public ReentrantLock getLock() {
        return lock;
    }

    public CachedTable getTable() {
        return table;
    }

    /**
     * Interval fetched so far, or null if nothing was fetched since the last clear.
     */
    public TimeRange getCoverage() {
        return coverage;
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }

    /**
     * Current row, as selected by the last {@link #setCurrentTime(Instant)}.
     */
    public Row get() {
        return current;
    }

    /**
     * Compute the interval that must be fetched so the cache covers a timepoint.
     *
     * @param timepoint   Time that must be covered
     * @param minDuration Minimal length of a newly fetched interval
     * @param maxSpan     Largest gap to the cached interval that is still bridged;
     *                    beyond it a fresh window around the timepoint is returned
     * @return Interval to fetch, or empty if the timepoint is already covered
     */
    public Optional<TimeRange> interval(Instant timepoint, Duration minDuration, Duration maxSpan) {
        TimeRange covered = coverage;
        TimeRange fresh = new TimeRange(timepoint.minus(LEAD_MARGIN), timepoint.plus(minDuration));
        Duration halfDuration = minDuration.dividedBy(2);

        if (covered == null) {
            return Optional.of(fresh);
        }
        if (timepoint.isBefore(covered.start())) {
            Duration gap = Duration.between(timepoint, covered.start());
            if (gap.compareTo(maxSpan) >= 0) {
                return Optional.of(fresh);
            }
            if (gap.compareTo(minDuration) < 0) {
                return Optional.of(new TimeRange(covered.start().minus(minDuration), covered.start()));
            }
            return Optional.of(new TimeRange(timepoint.minus(halfDuration), covered.start()));
        }
        if (timepoint.isAfter(covered.end())) {
            Duration gap = Duration.between(covered.end(), timepoint);
            if (gap.compareTo(maxSpan) >= 0) {
                return Optional.of(fresh);
            }
            if (gap.compareTo(minDuration) < 0) {
                return Optional.of(new TimeRange(covered.end(), covered.end().plus(minDuration)));
            }
            return Optional.of(new TimeRange(covered.end(), timepoint.plus(halfDuration)));
        }
        return Optional.empty();
    }

    /**
     * Merge freshly fetched rows into the table.
     *
     * @throws IllegalStateException if the rows interleave with the cached ones
     */
    public void merge(CachedTable rows) {
        CachedTable existing = table;
        if (existing.isEmpty()) {
            table = rows;
        } else if (!rows.isEmpty()) {
            table = existing.merge(rows);
        }
    }

    /**
     * Extend the coverage after the interval [start, end) was fetched and merged.
     * Coverage never shrinks here. Until the cache is first positioned by
     * {@link #setCurrentTime(Instant)}, selects the row at the coverage start.
     */
    public void update(Instant start, Instant end) {
        TimeRange fetched = new TimeRange(start, end);
        TimeRange covered = coverage;
        coverage = covered == null ? fetched : covered.union(fetched);
        synchronized (this) {
            if (currentTime == null && current == null) {
                current = table.floor(coverage.start());
            }
        }
    }

    /**
     * Select the last row at or before the timepoint as the current row.
     *
     * @return true if the current row changed, false if it is the same sample as before
     */
    public synchronized boolean setCurrentTime(Instant timepoint) {
        currentTime = timepoint;
        Row previous = current;
        Row row = table.floor(timepoint);
        current = row;
        if (row == null) {
            return previous != null;
        }
        return previous == null || !previous.timestamp().equals(row.timestamp());
    }

    /**
     * Playback time of the last {@link #setCurrentTime(Instant)}, or null if never positioned.
     */
    public synchronized Instant getCurrentTime() {
        return currentTime;
    }

    /**
     * Drop cached rows and coverage. The current row and the lock are kept.
     */
    public void clear() {
        table = CachedTable.empty();
        coverage = null;
    }

    @Override
    public String toString() {
        return "TopicCache[" + kind + " " + name + ", " + table.size() + " rows, coverage=" + coverage + "]";
    }
}
