package com.telereplay.core.cache;

import com.telereplay.core.archive.ArchiveClient;
import com.telereplay.core.model.TimeRange;
import com.telereplay.core.model.TopicKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Topic caches for all telemetry and event topics of one data source.
 *
 * On every playback position change the registry computes which topics need
 * more data ({@link #newRequests}), executes requests on behalf of the caller
 * ({@link #load}), drops topics the archive does not know ({@link #cleanup}) and
 * re-evaluates the current rows ({@link #refresh}).
 */
public class TopicCacheRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(TopicCacheRegistry.class);

    private final ArchiveClient archive;
    private final String sourceName;
    private final CacheSettings settings;
    private final Map<String, TopicCache> telemetry = new LinkedHashMap<>();
    private final Map<String, TopicCache> events = new LinkedHashMap<>();
    // Written by fetch workers, drained by cleanup()
    private final Set<TopicCache> pendingRemovals = ConcurrentHashMap.newKeySet();
    private final List<TopicUpdateListener> listeners = new CopyOnWriteArrayList<>();

    public TopicCacheRegistry(ArchiveClient archive, String sourceName,
                              List<String> telemetryTopics, List<String> eventTopics,
                              CacheSettings settings) {
        this.archive = archive;
        this.sourceName = sourceName;
        this.settings = settings;
        for (String topic : telemetryTopics) {
            telemetry.put(topic, new TopicCache(topic, TopicKind.TELEMETRY));
        }
        for (String topic : eventTopics) {
            events.put(topic, new TopicCache(topic, TopicKind.EVENT));
        }
        LOG.info("Topic cache for {} created with {} telemetry and {} event topics",
            sourceName, telemetry.size(), events.size());
    }

    public TopicCacheRegistry(ArchiveClient archive, String sourceName,
                              List<String> telemetryTopics, List<String> eventTopics) {
        this(archive, sourceName, telemetryTopics, eventTopics, CacheSettings.defaults());
    }

    public void addListener(TopicUpdateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TopicUpdateListener listener) {
        listeners.remove(listener);
    }

    public String getSourceName() {
        return sourceName;
    }

    public CacheSettings getSettings() {
        return settings;
    }

    /**
     * Archive series name of a topic, e.g. {@code lsst.sal.MTM1M3TS.logevent_heartbeat}.
     */
    public String seriesName(TopicKind kind, String topic) {
        return settings.seriesNamespace() + "." + sourceName + "." + kind.getSeriesPrefix() + topic;
    }

    /**
     * Build the requests needed to cover a playback time with at least
     * {@code minDuration} of data in every topic. Nothing is fetched here;
     * the caller runs the requests, possibly concurrently.
     */
    public synchronized List<FetchRequest> newRequests(Instant timepoint, Duration minDuration) {
        List<FetchRequest> requests = new ArrayList<>();
        collectRequests(telemetry, timepoint, minDuration, requests);
        collectRequests(events, timepoint, minDuration, requests);
        return requests;
    }

    private void collectRequests(Map<String, TopicCache> caches, Instant timepoint, Duration minDuration,
                                 List<FetchRequest> requests) {
        for (TopicCache cache : caches.values()) {
            if (pendingRemovals.contains(cache)) continue;

            Optional<TimeRange> range = cache.interval(timepoint, minDuration, settings.maxSpan());
            if (range.isEmpty()) {
                LOG.debug("Already fetched {} at time {} for {}", cache.getName(), timepoint, minDuration);
                continue;
            }
            requests.add(new FetchRequest(cache, seriesName(cache.getKind(), cache.getName()),
                settings.fields(), range.get(), settings.chunkFor(cache.getKind())));
        }
    }

    /**
     * Execute a request. A topic whose series does not exist is flagged and
     * removed by the next {@link #cleanup()}.
     */
    public FetchOutcome load(FetchRequest request) {
        FetchOutcome outcome = request.load(archive);
        if (outcome == FetchOutcome.SERIES_NOT_FOUND) {
            pendingRemovals.add(request.getCache());
        }
        return outcome;
    }

    /**
     * Remove topics found missing in the archive.
     */
    public synchronized void cleanup() {
        if (pendingRemovals.isEmpty()) return;

        for (TopicCache cache : List.copyOf(pendingRemovals)) {
            Map<String, TopicCache> caches = cache.getKind() == TopicKind.EVENT ? events : telemetry;
            if (caches.remove(cache.getName(), cache)) {
                LOG.info("Removed {} topic {} - no such series in archive", cache.getKind(), cache.getName());
                notifyRemoved(cache.getKind(), cache.getName());
            }
            pendingRemovals.remove(cache);
        }
    }

    /**
     * Move every topic to the playback time and notify listeners of topics
     * whose current row changed.
     *
     * @return Snapshots of the changed topics
     */
    public synchronized List<TopicSnapshot> refresh(Instant timepoint) {
        List<TopicSnapshot> changed = new ArrayList<>();
        for (TopicCache cache : allCaches()) {
            if (cache.setCurrentTime(timepoint)) {
                changed.add(new TopicSnapshot(cache.getName(), cache.getKind(), cache.get()));
            }
        }
        for (TopicSnapshot snapshot : changed) {
            notifyChanged(snapshot);
        }
        return changed;
    }

    /**
     * Look up a topic, telemetry first.
     */
    public synchronized TopicCache get(String topic) {
        TopicCache cache = telemetry.get(topic);
        return cache != null ? cache : events.get(topic);
    }

    public synchronized TopicCache getTelemetry(String topic) {
        return telemetry.get(topic);
    }

    public synchronized TopicCache getEvent(String topic) {
        return events.get(topic);
    }

    public synchronized List<String> getTelemetryTopics() {
        return List.copyOf(telemetry.keySet());
    }

    public synchronized List<String> getEventTopics() {
        return List.copyOf(events.keySet());
    }

    public synchronized List<TopicCache> allCaches() {
        List<TopicCache> all = new ArrayList<>(telemetry.size() + events.size());
        all.addAll(telemetry.values());
        all.addAll(events.values());
        return all;
    }

    private void notifyChanged(TopicSnapshot snapshot) {
        for (TopicUpdateListener listener : listeners) {
            try {
                listener.onTopicChanged(snapshot);
            } catch (Exception e) {
                LOG.warn("Listener error", e);
            }
        }
    }

    private void notifyRemoved(TopicKind kind, String topic) {
        for (TopicUpdateListener listener : listeners) {
            try {
                listener.onTopicRemoved(kind, topic);
            } catch (Exception e) {
                LOG.warn("Listener error", e);
            }
        }
    }
}
