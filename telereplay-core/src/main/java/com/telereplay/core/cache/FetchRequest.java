package com.telereplay.core.cache;

import com.telereplay.core.archive.ArchiveClient;
import com.telereplay.core.archive.ArchiveException;
import com.telereplay.core.archive.SeriesNotFoundException;
import com.telereplay.core.model.Row;
import com.telereplay.core.model.TimeRange;
import com.telereplay.core.model.TopicKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * One extension of a {@link TopicCache}: the range [start, end) to fetch, split
 * into archive calls no longer than the chunk limit.
 *
 * Requests are created by {@link TopicCacheRegistry#newRequests(Instant, Duration)},
 * executed once and discarded.
 */
public final class FetchRequest {
    private static final Logger LOG = LoggerFactory.getLogger(FetchRequest.class);

    private final TopicCache cache;
    private final String seriesName;
    private final List<String> fields;
    private final Instant start;
    private final Instant end;
    private final Duration chunkLimit;

    public FetchRequest(TopicCache cache, String seriesName, List<String> fields,
                        TimeRange range, Duration chunkLimit) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.seriesName = Objects.requireNonNull(seriesName, "seriesName");
        this.fields = List.copyOf(fields);
        this.start = range.start();
        this.end = range.end();
        if (chunkLimit.isNegative() || chunkLimit.isZero()) {
            throw new IllegalArgumentException("chunkLimit must be positive: " + chunkLimit);
        }
        this.chunkLimit = chunkLimit;
    }

    public String getTopic() {
        return cache.getName();
    }

    public TopicKind getKind() {
        return cache.getKind();
    }

    public TopicCache getCache() {
        return cache;
    }

    public String getSeriesName() {
        return seriesName;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public TimeRange getRange() {
        return new TimeRange(start, end);
    }

    public Duration getChunkLimit() {
        return chunkLimit;
    }

    /**
     * Fetch the range and merge it into the topic cache, chunk by chunk.
     * Holds the topic lock for the whole execution; a second request for the
     * same topic waits until this one finishes. Archive errors end the request
     * early and are reported through the outcome, never thrown.
     *
     * @throws IllegalStateException if fetched rows interleave with the cached ones
     */
    public FetchOutcome load(ArchiveClient archive) {
        try {
            cache.getLock().lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.CANCELLED;
        }
        try {
            return isBackward() ? loadBackward(archive) : loadForward(archive);
        } finally {
            cache.getLock().unlock();
        }
    }

    /**
     * True when this request extends the cached interval towards the past.
     * Evaluated against the cache state at the time of the call.
     */
    public boolean isBackward() {
        TimeRange coverage = cache.getCoverage();
        return coverage != null && !end.isAfter(coverage.start());
    }

    private FetchOutcome loadForward(ArchiveClient archive) {
        TimeRange coverage = cache.getCoverage();
        if (coverage != null && !coverage.end().equals(start)) {
            LOG.debug("{} cached {} is disjoint from {} - clearing", getTopic(), coverage, getRange());
            cache.clear();
        }

        Instant chunkStart = start;
        while (chunkStart.isBefore(end)) {
            Instant chunkEnd = min(chunkStart.plus(chunkLimit), end);
            FetchOutcome outcome = fetchChunk(archive, chunkStart, chunkEnd);
            if (outcome != FetchOutcome.COMPLETED) {
                return outcome;
            }
            chunkStart = chunkEnd;
        }
        return FetchOutcome.COMPLETED;
    }

    private FetchOutcome loadBackward(ArchiveClient archive) {
        TimeRange coverage = cache.getCoverage();
        if (coverage != null && !coverage.start().equals(end)) {
            LOG.debug("{} cached {} is disjoint from {} - clearing", getTopic(), coverage, getRange());
            cache.clear();
        }

        Instant chunkEnd = end;
        while (chunkEnd.isAfter(start)) {
            Instant chunkStart = max(chunkEnd.minus(chunkLimit), start);
            FetchOutcome outcome = fetchChunk(archive, chunkStart, chunkEnd);
            if (outcome != FetchOutcome.COMPLETED) {
                return outcome;
            }
            chunkEnd = chunkStart;
        }
        return FetchOutcome.COMPLETED;
    }

    private FetchOutcome fetchChunk(ArchiveClient archive, Instant chunkStart, Instant chunkEnd) {
        if (Thread.currentThread().isInterrupted()) {
            return FetchOutcome.CANCELLED;
        }

        LOG.debug("Fetching {} - {} to {}", getTopic(), chunkStart, chunkEnd);
        long queryStart = System.nanoTime();
        List<Row> rows;
        try {
            rows = archive.selectTimeSeries(seriesName, fields, chunkStart, chunkEnd);
        } catch (SeriesNotFoundException e) {
            LOG.warn("Topic {} is not in the archive - will be ignored: {}", getTopic(), e.getMessage());
            return FetchOutcome.SERIES_NOT_FOUND;
        } catch (ArchiveException e) {
            LOG.error("Error while fetching {} - no data retrieved for {} to {}: {}",
                getTopic(), chunkStart, chunkEnd, e.getMessage());
            return FetchOutcome.FAILED;
        } catch (RuntimeException e) {
            LOG.error("Unexpected error while fetching {} - no data retrieved for {} to {}",
                getTopic(), chunkStart, chunkEnd, e);
            return FetchOutcome.FAILED;
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - queryStart);

        cache.merge(CachedTable.of(rows));
        cache.update(chunkStart, chunkEnd);

        LOG.info("Fetched {} rows from {} in {} ms - {} rows/second",
            rows.size(), getTopic(), elapsedMs,
            elapsedMs > 0 ? String.format("%.2f", rows.size() * 1000.0 / elapsedMs) : "n/a");
        return FetchOutcome.COMPLETED;
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    @Override
    public String toString() {
        return "FetchRequest[" + seriesName + " " + getRange() + ", chunk=" + chunkLimit + "]";
    }
}
