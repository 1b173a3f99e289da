package com.telereplay.player.config;

import com.telereplay.core.cache.CacheSettings;
import com.telereplay.core.util.DurationParser;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration for a replay session.
 */
public class ReplayConfig {
    private static final String DEFAULT_ARCHIVE_URL = "http://localhost:8086";
    private static final String DEFAULT_DATABASE = "efd";
    private static final String DEFAULT_SOURCE = "MTM1M3TS";
    private static final int DEFAULT_MAX_FETCHES = 10;

    private final String archiveUrl;
    private final String database;
    private final String username;
    private final String password;
    private final Duration archiveTimeout;
    private final String source;
    private final String namespace;
    private final Duration window;
    private final Duration maxSpan;
    private final Duration telemetryChunk;
    private final Duration eventChunk;
    private final int maxConcurrentFetches;

    public ReplayConfig(String archiveUrl, String database, String username, String password,
                        Duration archiveTimeout, String source, String namespace, Duration window, Duration maxSpan,
                        Duration telemetryChunk, Duration eventChunk, int maxConcurrentFetches) {
        if (maxConcurrentFetches < 1) {
            throw new IllegalArgumentException("maxConcurrentFetches must be at least 1: " + maxConcurrentFetches);
        }
        this.archiveUrl = archiveUrl;
        this.database = database;
        this.username = username;
        this.password = password;
        this.archiveTimeout = archiveTimeout;
        this.source = source;
        this.namespace = namespace;
        this.window = window;
        this.maxSpan = maxSpan;
        this.telemetryChunk = telemetryChunk;
        this.eventChunk = eventChunk;
        this.maxConcurrentFetches = maxConcurrentFetches;
    }

    public static ReplayConfig load() {
        return load(System.getenv());
    }

    /**
     * Load from system properties, then the given environment, then defaults.
     */
    static ReplayConfig load(Map<String, String> env) {
        String archiveUrl = setting(env, "telereplay.archive.url", "TELEREPLAY_ARCHIVE_URL", DEFAULT_ARCHIVE_URL);
        String database = setting(env, "telereplay.archive.database", "TELEREPLAY_ARCHIVE_DATABASE", DEFAULT_DATABASE);
        String username = setting(env, "telereplay.archive.username", "TELEREPLAY_ARCHIVE_USERNAME", null);
        String password = setting(env, "telereplay.archive.password", "TELEREPLAY_ARCHIVE_PASSWORD", null);
        Duration archiveTimeout = DurationParser.parse(
            setting(env, "telereplay.archive.timeout", "TELEREPLAY_ARCHIVE_TIMEOUT", "5m"));
        String source = setting(env, "telereplay.source", "TELEREPLAY_SOURCE", DEFAULT_SOURCE);
        String namespace = setting(env, "telereplay.namespace", "TELEREPLAY_NAMESPACE",
            CacheSettings.DEFAULT_NAMESPACE);

        Duration window = DurationParser.parse(setting(env, "telereplay.window", "TELEREPLAY_WINDOW", "60s"));
        Duration maxSpan = DurationParser.parse(setting(env, "telereplay.max_span", "TELEREPLAY_MAX_SPAN", "10m"));
        Duration telemetryChunk = DurationParser.parse(
            setting(env, "telereplay.telemetry_chunk", "TELEREPLAY_TELEMETRY_CHUNK", "120.05s"));
        Duration eventChunk = DurationParser.parse(
            setting(env, "telereplay.event_chunk", "TELEREPLAY_EVENT_CHUNK", "600.05s"));

        int maxFetches = Integer.parseInt(setting(env, "telereplay.max_fetches", "TELEREPLAY_MAX_FETCHES",
            String.valueOf(DEFAULT_MAX_FETCHES)));

        return new ReplayConfig(archiveUrl, database, username, password, archiveTimeout, source, namespace,
            window, maxSpan, telemetryChunk, eventChunk, maxFetches);
    }

    private static String setting(Map<String, String> env, String property, String variable, String defaultValue) {
        return System.getProperty(property, env.getOrDefault(variable, defaultValue));
    }

    public CacheSettings toCacheSettings() {
        return new CacheSettings(maxSpan, telemetryChunk, eventChunk, namespace, List.of());
    }

    public String getArchiveUrl() {
        return archiveUrl;
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    /**
     * Longest wait for a single archive query.
     */
    public Duration getArchiveTimeout() {
        return archiveTimeout;
    }

    public String getSource() {
        return source;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Minimum amount of data kept ahead of the playback position.
     */
    public Duration getWindow() {
        return window;
    }

    public Duration getMaxSpan() {
        return maxSpan;
    }

    public Duration getTelemetryChunk() {
        return telemetryChunk;
    }

    public Duration getEventChunk() {
        return eventChunk;
    }

    public int getMaxConcurrentFetches() {
        return maxConcurrentFetches;
    }

    @Override
    public String toString() {
        return "ReplayConfig[" + archiveUrl + "/" + database + ", source=" + source
            + ", window=" + window + ", maxSpan=" + maxSpan + ", fetches=" + maxConcurrentFetches + "]";
    }
}
