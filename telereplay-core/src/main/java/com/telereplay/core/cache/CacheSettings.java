package com.telereplay.core.cache;

import com.telereplay.core.model.TopicKind;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Tuning of a {@link TopicCacheRegistry}.
 *
 * @param maxSpan         Gap beyond which the cache is reset instead of bridged
 * @param telemetryChunk  Longest range fetched by a single archive call for telemetry
 * @param eventChunk      Longest range fetched by a single archive call for events
 * @param seriesNamespace First component of archive series names
 * @param fields          Fields to select, empty for all
 */
public record CacheSettings(
    Duration maxSpan,
    Duration telemetryChunk,
    Duration eventChunk,
    String seriesNamespace,
    List<String> fields
) {
    public static final Duration DEFAULT_MAX_SPAN = Duration.ofMinutes(10);
    public static final Duration DEFAULT_TELEMETRY_CHUNK = Duration.ofMillis(120_050);
    public static final Duration DEFAULT_EVENT_CHUNK = Duration.ofMillis(600_050);
    public static final String DEFAULT_NAMESPACE = "lsst.sal";

    public CacheSettings {
        Objects.requireNonNull(maxSpan, "maxSpan");
        requirePositive(telemetryChunk, "telemetryChunk");
        requirePositive(eventChunk, "eventChunk");
        Objects.requireNonNull(seriesNamespace, "seriesNamespace");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    private static void requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + duration);
        }
    }

    public static CacheSettings defaults() {
        return new CacheSettings(DEFAULT_MAX_SPAN, DEFAULT_TELEMETRY_CHUNK, DEFAULT_EVENT_CHUNK,
            DEFAULT_NAMESPACE, List.of());
    }

    /**
     * Chunk limit for a topic kind. Events are sparse and can be fetched in wider chunks.
     */
    public Duration chunkFor(TopicKind kind) {
        return kind == TopicKind.EVENT ? eventChunk : telemetryChunk;
    }

    public CacheSettings withMaxSpan(Duration maxSpan) {
        return new CacheSettings(maxSpan, telemetryChunk, eventChunk, seriesNamespace, fields);
    }
}
