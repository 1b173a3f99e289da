package com.telereplay.player;

import com.telereplay.core.archive.ArchiveClient;
import com.telereplay.core.archive.ArchiveException;
import com.telereplay.core.archive.SeriesNotFoundException;
import com.telereplay.core.cache.FetchOutcome;
import com.telereplay.core.cache.FetchRequest;
import com.telereplay.core.cache.TopicCacheRegistry;
import com.telereplay.core.cache.TopicSnapshot;
import com.telereplay.core.cache.TopicUpdateListener;
import com.telereplay.core.model.Row;
import com.telereplay.core.model.TopicKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class PlayerTest {

    private static final Instant T0 = Instant.parse("2025-05-19T23:40:00Z");
    private static final Duration WINDOW = Duration.ofSeconds(60);
    private static final String PREFIX = "lsst.sal.MTM1M3TS.";

    private Player player;

    @AfterEach
    void tearDown() {
        if (player != null) {
            player.close();
        }
    }

    /**
     * One row per second for every known series.
     */
    private static class SecondsArchive implements ArchiveClient {
        private final Set<String> known;
        private final List<String> calls = new CopyOnWriteArrayList<>();

        SecondsArchive(String... known) {
            this.known = Set.of(known);
        }

        @Override
        public List<Row> selectTimeSeries(String seriesName, List<String> fields, Instant start, Instant end)
                throws ArchiveException {
            calls.add(seriesName);
            if (!known.contains(seriesName)) {
                throw new SeriesNotFoundException(seriesName);
            }
            List<Row> rows = new ArrayList<>();
            Instant t = start.getNano() == 0 ? start : Instant.ofEpochSecond(start.getEpochSecond() + 1);
            for (; t.isBefore(end); t = t.plusSeconds(1)) {
                rows.add(new Row(t, Map.of("salIndex", 1L)));
            }
            return rows;
        }
    }

    private Player createPlayer(ArchiveClient archive, int fetches) {
        TopicCacheRegistry registry = new TopicCacheRegistry(archive, "MTM1M3TS",
            List.of("thermalData", "mixingValve"), List.of("heartbeat", "thermalWarning"));
        player = new Player(registry, WINDOW, fetches);
        return player;
    }

    @Nested
    @DisplayName("Replay")
    class ReplayTests {

        @Test
        @DisplayName("First replay fetches every topic and reports the current rows")
        void firstReplay() throws Exception {
            SecondsArchive archive = new SecondsArchive(PREFIX + "thermalData", PREFIX + "mixingValve",
                PREFIX + "logevent_heartbeat");
            createPlayer(archive, 4);

            List<TopicSnapshot> changed = player.replay(T0.plusMillis(2020));

            assertEquals(List.of("thermalData", "mixingValve", "heartbeat"),
                changed.stream().map(TopicSnapshot::topic).toList());
            for (TopicSnapshot snapshot : changed) {
                assertEquals(T0.plusSeconds(2), snapshot.row().timestamp());
            }
            assertEquals(TopicKind.EVENT, changed.get(2).kind());
        }

        @Test
        @DisplayName("Missing series are dropped after the step that found them")
        void missingTopicDropped() throws Exception {
            SecondsArchive archive = new SecondsArchive(PREFIX + "thermalData");
            Player p = createPlayer(archive, 2);
            List<String> removed = new CopyOnWriteArrayList<>();
            p.getRegistry().addListener(new TopicUpdateListener() {
                @Override
                public void onTopicChanged(TopicSnapshot snapshot) {
                }

                @Override
                public void onTopicRemoved(TopicKind kind, String topic) {
                    removed.add(topic);
                }
            });

            p.replay(T0);

            assertEquals(List.of("thermalData"), p.getRegistry().getTelemetryTopics());
            assertTrue(p.getRegistry().getEventTopics().isEmpty());
            assertEquals(Set.of("mixingValve", "heartbeat", "thermalWarning"), Set.copyOf(removed));

            archive.calls.clear();
            p.replay(T0.plusSeconds(3600));
            assertEquals(List.of(PREFIX + "thermalData"), List.copyOf(archive.calls));
        }

        @Test
        @DisplayName("Replaying a cached position fetches nothing")
        void cachedPosition() throws Exception {
            SecondsArchive archive = new SecondsArchive(PREFIX + "thermalData", PREFIX + "mixingValve",
                PREFIX + "logevent_heartbeat", PREFIX + "logevent_thermalWarning");
            createPlayer(archive, 4);
            player.replay(T0);
            archive.calls.clear();

            List<TopicSnapshot> changed = player.replay(T0.plusSeconds(10));

            assertTrue(archive.calls.isEmpty());
            assertEquals(4, changed.size());
            assertTrue(player.replay(T0.plusMillis(10_500)).isEmpty(), "Same rows are not reported again");
        }

        @Test
        @DisplayName("Unexpected fetch errors are contained in the step")
        void unexpectedError() throws Exception {
            ArchiveClient broken = (series, fields, start, end) -> {
                throw new IllegalStateException("connection reset by peer");
            };
            createPlayer(broken, 2);
            List<FetchOutcome> outcomes = new CopyOnWriteArrayList<>();
            player.addListener(new FetchListener() {
                @Override
                public void onRequestStarted(FetchRequest request, int worker) {
                }

                @Override
                public void onRequestFinished(FetchRequest request, int worker, FetchOutcome outcome,
                                              Duration elapsed) {
                    outcomes.add(outcome);
                }
            });

            List<TopicSnapshot> changed = assertDoesNotThrow(() -> player.replay(T0));

            assertTrue(changed.isEmpty());
            assertEquals(List.of(FetchOutcome.FAILED, FetchOutcome.FAILED, FetchOutcome.FAILED, FetchOutcome.FAILED),
                List.copyOf(outcomes));
        }

        @Test
        @DisplayName("Asynchronous replay completes with the changed topics")
        void replayAsync() throws Exception {
            createPlayer(new SecondsArchive(PREFIX + "thermalData"), 2);

            List<TopicSnapshot> changed = player.replayAsync(T0.plusSeconds(1)).get(10, TimeUnit.SECONDS);

            assertEquals(1, changed.size());
            assertEquals(T0.plusSeconds(1), changed.get(0).row().timestamp());
        }
    }

    @Nested
    @DisplayName("Workers")
    class WorkerTests {

        @Test
        @DisplayName("Topics are fetched concurrently up to the pool size")
        void concurrentFetches() throws Exception {
            CountDownLatch bothRunning = new CountDownLatch(2);
            AtomicInteger active = new AtomicInteger();
            AtomicInteger maxActive = new AtomicInteger();
            SecondsArchive delegate = new SecondsArchive(PREFIX + "thermalData", PREFIX + "mixingValve",
                PREFIX + "logevent_heartbeat", PREFIX + "logevent_thermalWarning");
            ArchiveClient archive = (series, fields, start, end) -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                try {
                    bothRunning.countDown();
                    bothRunning.await(5, TimeUnit.SECONDS);
                    return delegate.selectTimeSeries(series, fields, start, end);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ArchiveException("Interrupted", e);
                } finally {
                    active.decrementAndGet();
                }
            };
            createPlayer(archive, 2);

            player.replay(T0);

            assertEquals(0, bothRunning.getCount(), "Two fetches ran at the same time");
            assertEquals(2, maxActive.get());
        }

        @Test
        @DisplayName("Listeners see every request start and finish on a pool worker")
        void fetchListener() throws Exception {
            createPlayer(new SecondsArchive(PREFIX + "thermalData", PREFIX + "mixingValve",
                PREFIX + "logevent_heartbeat"), 3);
            List<String> events = new CopyOnWriteArrayList<>();
            List<Integer> workers = new CopyOnWriteArrayList<>();
            player.addListener(new FetchListener() {
                @Override
                public void onRequestStarted(FetchRequest request, int worker) {
                    events.add("start " + request.getTopic());
                    workers.add(worker);
                }

                @Override
                public void onRequestFinished(FetchRequest request, int worker, FetchOutcome outcome,
                                              Duration elapsed) {
                    events.add(outcome + " " + request.getTopic());
                    assertFalse(elapsed.isNegative());
                }
            });

            player.replay(T0);

            assertEquals(8, events.size());
            assertTrue(events.contains("COMPLETED thermalData"));
            assertTrue(events.contains("SERIES_NOT_FOUND thermalWarning"));
            assertTrue(workers.stream().allMatch(w -> w >= 0 && w < 3));
        }
    }

    @Test
    @DisplayName("Seek moves within cached data without fetching")
    void seek() throws Exception {
        SecondsArchive archive = new SecondsArchive(PREFIX + "thermalData");
        createPlayer(archive, 2);
        player.replay(T0);
        int calls = archive.calls.size();

        List<TopicSnapshot> changed = player.seek(T0.plusSeconds(30));

        assertEquals(calls, archive.calls.size());
        assertEquals(1, changed.size());
        assertEquals(T0.plusSeconds(30), changed.get(0).row().timestamp());

        List<TopicSnapshot> outside = player.seek(T0.plusSeconds(3600));
        assertEquals(calls, archive.calls.size(), "Seek never fetches");
        assertEquals(1, outside.size());
        assertEquals(T0.plusSeconds(59), outside.get(0).row().timestamp(), "Last cached row stays current");
    }

    @Test
    @DisplayName("Invalid pool size is rejected")
    void invalidPoolSize() {
        TopicCacheRegistry registry = new TopicCacheRegistry(new SecondsArchive(), "MTM1M3TS", List.of(), List.of());
        assertThrows(IllegalArgumentException.class, () -> new Player(registry, WINDOW, 0));
    }
}
