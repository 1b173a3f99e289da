package com.telereplay.player.config;

import com.telereplay.core.cache.CacheSettings;
import com.telereplay.core.model.TopicKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReplayConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("telereplay.window");
        System.clearProperty("telereplay.max_fetches");
        System.clearProperty("telereplay.source");
    }

    @Test
    @DisplayName("Defaults apply without properties or environment")
    void defaults() {
        ReplayConfig config = ReplayConfig.load(Map.of());

        assertEquals("http://localhost:8086", config.getArchiveUrl());
        assertEquals("efd", config.getDatabase());
        assertNull(config.getUsername());
        assertEquals(Duration.ofMinutes(5), config.getArchiveTimeout());
        assertEquals("MTM1M3TS", config.getSource());
        assertEquals("lsst.sal", config.getNamespace());
        assertEquals(Duration.ofSeconds(60), config.getWindow());
        assertEquals(Duration.ofMinutes(10), config.getMaxSpan());
        assertEquals(Duration.ofMillis(120_050), config.getTelemetryChunk());
        assertEquals(Duration.ofMillis(600_050), config.getEventChunk());
        assertEquals(10, config.getMaxConcurrentFetches());
    }

    @Test
    @DisplayName("Environment overrides defaults")
    void environment() {
        ReplayConfig config = ReplayConfig.load(Map.of(
            "TELEREPLAY_ARCHIVE_URL", "https://archive.example.org:8443",
            "TELEREPLAY_ARCHIVE_USERNAME", "reader",
            "TELEREPLAY_ARCHIVE_TIMEOUT", "90s",
            "TELEREPLAY_WINDOW", "2m30s",
            "TELEREPLAY_MAX_FETCHES", "4"));

        assertEquals("https://archive.example.org:8443", config.getArchiveUrl());
        assertEquals("reader", config.getUsername());
        assertEquals(Duration.ofSeconds(90), config.getArchiveTimeout());
        assertEquals(Duration.ofSeconds(150), config.getWindow());
        assertEquals(4, config.getMaxConcurrentFetches());
    }

    @Test
    @DisplayName("System properties override the environment")
    void systemProperties() {
        System.setProperty("telereplay.window", "1h");
        System.setProperty("telereplay.source", "MTMount");

        ReplayConfig config = ReplayConfig.load(Map.of("TELEREPLAY_WINDOW", "5m"));

        assertEquals(Duration.ofHours(1), config.getWindow());
        assertEquals("MTMount", config.getSource());
    }

    @Test
    @DisplayName("Invalid values fail at load")
    void invalidValues() {
        assertThrows(IllegalArgumentException.class, () -> ReplayConfig.load(Map.of("TELEREPLAY_WINDOW", "5x")));
        assertThrows(NumberFormatException.class, () -> ReplayConfig.load(Map.of("TELEREPLAY_MAX_FETCHES", "many")));
        assertThrows(IllegalArgumentException.class, () -> ReplayConfig.load(Map.of("TELEREPLAY_MAX_FETCHES", "0")));
    }

    @Test
    @DisplayName("Cache settings carry spans, chunks and namespace")
    void cacheSettings() {
        CacheSettings settings = ReplayConfig.load(Map.of(
            "TELEREPLAY_MAX_SPAN", "30m",
            "TELEREPLAY_EVENT_CHUNK", "1h",
            "TELEREPLAY_NAMESPACE", "lsst.obsenv")).toCacheSettings();

        assertEquals(Duration.ofMinutes(30), settings.maxSpan());
        assertEquals(Duration.ofHours(1), settings.chunkFor(TopicKind.EVENT));
        assertEquals(CacheSettings.DEFAULT_TELEMETRY_CHUNK, settings.chunkFor(TopicKind.TELEMETRY));
        assertEquals("lsst.obsenv", settings.seriesNamespace());
        assertTrue(settings.fields().isEmpty());
    }
}
