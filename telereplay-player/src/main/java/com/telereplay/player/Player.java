package com.telereplay.player;

import com.telereplay.core.cache.FetchOutcome;
import com.telereplay.core.cache.FetchRequest;
import com.telereplay.core.cache.TopicCacheRegistry;
import com.telereplay.core.cache.TopicSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a {@link TopicCacheRegistry} through playback positions.
 *
 * Each replay step drops missing topics, schedules the fetches the new
 * position needs, runs them on a fixed worker pool, and finally refreshes the
 * current rows. Steps submitted through {@link #replayAsync(Instant)} run one
 * after another.
 */
public class Player implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Player.class);

    private static final ThreadLocal<Integer> WORKER = ThreadLocal.withInitial(() -> -1);

    private final TopicCacheRegistry registry;
    private final Duration window;
    private final ExecutorService fetchExecutor;
    private final ExecutorService stepExecutor;
    private final List<FetchListener> listeners = new CopyOnWriteArrayList<>();

    public Player(TopicCacheRegistry registry, Duration window, int maxConcurrentFetches) {
        if (maxConcurrentFetches < 1) {
            throw new IllegalArgumentException("maxConcurrentFetches must be at least 1: " + maxConcurrentFetches);
        }
        this.registry = registry;
        this.window = window;
        this.fetchExecutor = Executors.newFixedThreadPool(maxConcurrentFetches, workerFactory());
        this.stepExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "replay-step");
            t.setDaemon(true);
            return t;
        });
    }

    private static ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            int id = counter.getAndIncrement();
            Thread t = new Thread(() -> {
                WORKER.set(id);
                r.run();
            }, "replay-fetch-" + id);
            t.setDaemon(true);
            return t;
        };
    }

    public void addListener(FetchListener listener) {
        listeners.add(listener);
    }

    public void removeListener(FetchListener listener) {
        listeners.remove(listener);
    }

    public TopicCacheRegistry getRegistry() {
        return registry;
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * Fetch whatever the playback position needs and move every topic to it.
     * Blocks until all fetches of this step finished.
     *
     * @return Snapshots of the topics whose current row changed
     * @throws InterruptedException if interrupted while waiting; running fetches are cancelled
     */
    public List<TopicSnapshot> replay(Instant timepoint) throws InterruptedException {
        long stepStart = System.nanoTime();
        registry.cleanup();

        List<FetchRequest> requests = registry.newRequests(timepoint, window);
        List<Future<FetchOutcome>> futures = new ArrayList<>(requests.size());
        for (FetchRequest request : requests) {
            futures.add(fetchExecutor.submit(() -> execute(request)));
        }

        int failed = 0;
        try {
            for (int i = 0; i < futures.size(); i++) {
                try {
                    if (futures.get(i).get() != FetchOutcome.COMPLETED) {
                        failed++;
                    }
                } catch (ExecutionException e) {
                    failed++;
                    LOG.error("Fetch aborted for {}", requests.get(i), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        }

        registry.cleanup();
        List<TopicSnapshot> changed = registry.refresh(timepoint);

        LOG.info("Replayed {} - {} requests ({} incomplete), {} topics changed in {} ms",
            timepoint, requests.size(), failed, changed.size(),
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - stepStart));
        return changed;
    }

    /**
     * Run {@link #replay(Instant)} on the player's step thread.
     */
    public CompletableFuture<List<TopicSnapshot>> replayAsync(Instant timepoint) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return replay(timepoint);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        }, stepExecutor);
    }

    /**
     * Move to a playback position using cached data only. May run while a
     * replay step is fetching; rows merged afterwards become current on the
     * next replay or seek.
     */
    public List<TopicSnapshot> seek(Instant timepoint) {
        return registry.refresh(timepoint);
    }

    private FetchOutcome execute(FetchRequest request) {
        int worker = WORKER.get();
        notifyStarted(request, worker);
        long start = System.nanoTime();
        FetchOutcome outcome = FetchOutcome.FAILED;
        try {
            outcome = registry.load(request);
            return outcome;
        } finally {
            notifyFinished(request, worker, outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private void notifyStarted(FetchRequest request, int worker) {
        for (FetchListener listener : listeners) {
            try {
                listener.onRequestStarted(request, worker);
            } catch (Exception e) {
                LOG.warn("Listener error", e);
            }
        }
    }

    private void notifyFinished(FetchRequest request, int worker, FetchOutcome outcome, Duration elapsed) {
        for (FetchListener listener : listeners) {
            try {
                listener.onRequestFinished(request, worker, outcome, elapsed);
            } catch (Exception e) {
                LOG.warn("Listener error", e);
            }
        }
    }

    /**
     * Stop accepting steps and wait for running fetches.
     */
    @Override
    public void close() {
        stepExecutor.shutdown();
        fetchExecutor.shutdown();
        try {
            stepExecutor.awaitTermination(30, TimeUnit.SECONDS);
            if (!fetchExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Fetches still running after 30 seconds - interrupting");
                fetchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
