package com.telereplay.player.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Telemetry and event topics published by one data source.
 *
 * JSON form: {@code {"source": "MTM1M3TS", "telemetry": [...], "events": [...]}}
 */
public record TopicCatalog(String source, List<String> telemetry, List<String> events) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public TopicCatalog {
        Objects.requireNonNull(source, "source");
        telemetry = telemetry == null ? List.of() : List.copyOf(telemetry);
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static TopicCatalog load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, TopicCatalog.class);
        }
    }

    /**
     * Load the catalog bundled for a source from {@code /catalogs/<source>.json}.
     *
     * @throws IOException if no catalog is bundled for the source
     */
    public static TopicCatalog forSource(String source) throws IOException {
        String resource = "/catalogs/" + source + ".json";
        try (InputStream in = TopicCatalog.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("No topic catalog for source " + source + " (" + resource + ")");
            }
            return MAPPER.readValue(in, TopicCatalog.class);
        }
    }
}
