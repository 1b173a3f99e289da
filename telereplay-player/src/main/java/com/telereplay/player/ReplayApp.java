package com.telereplay.player;

import com.telereplay.archive.HttpClientFactory;
import com.telereplay.archive.InfluxArchiveClient;
import com.telereplay.core.cache.TopicCacheRegistry;
import com.telereplay.player.config.ReplayConfig;
import com.telereplay.player.config.TopicCatalog;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line replay of archived telemetry.
 *
 * Usage: {@code ReplayApp [catalog.json] <timepoint> [<timepoint> ...]}
 *
 * Every timepoint is an ISO-8601 instant. Changed topics are written to stdout
 * as JSON lines; logging goes to stderr.
 */
public class ReplayApp {
    private static final Logger LOG = LoggerFactory.getLogger(ReplayApp.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: ReplayApp [catalog.json] <timepoint> [<timepoint> ...]");
            System.exit(2);
        }

        try {
            ReplayConfig config = ReplayConfig.load();
            LOG.info("Starting replay with {}", config);

            Arguments arguments = Arguments.parse(args);
            TopicCatalog catalog = arguments.catalog() != null
                ? TopicCatalog.load(arguments.catalog())
                : TopicCatalog.forSource(config.getSource());

            OkHttpClient httpClient = HttpClientFactory.newClient(config.getArchiveTimeout(),
                config.getMaxConcurrentFetches());
            InfluxArchiveClient archive = new InfluxArchiveClient(config.getArchiveUrl(), config.getDatabase(),
                config.getUsername(), config.getPassword(), httpClient, HttpClientFactory.getMapper());
            TopicCacheRegistry registry = new TopicCacheRegistry(archive, catalog.source(),
                catalog.telemetry(), catalog.events(), config.toCacheSettings());

            SnapshotPrinter printer = new SnapshotPrinter(System.out);
            registry.addListener(printer);

            try (Player player = new Player(registry, config.getWindow(), config.getMaxConcurrentFetches())) {
                for (Instant timepoint : arguments.timepoints()) {
                    printer.setPlaybackTime(timepoint);
                    player.replay(timepoint);
                }
            }
            System.out.flush();
        } catch (IllegalArgumentException | IOException e) {
            LOG.error("Replay failed: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Replay interrupted");
            System.exit(130);
        } catch (Exception e) {
            LOG.error("Replay failed", e);
            System.exit(1);
        }
    }

    /**
     * Parsed command line: optional catalog file followed by timepoints.
     */
    record Arguments(Path catalog, List<Instant> timepoints) {

        static Arguments parse(String[] args) {
            List<String> rest = new ArrayList<>(Arrays.asList(args));
            Path catalog = null;
            if (!rest.isEmpty() && rest.get(0).endsWith(".json")) {
                catalog = Path.of(rest.remove(0));
            }
            if (rest.isEmpty()) {
                throw new IllegalArgumentException("No timepoint given");
            }

            List<Instant> timepoints = new ArrayList<>(rest.size());
            for (String value : rest) {
                try {
                    timepoints.add(Instant.parse(value));
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Invalid timepoint: " + value, e);
                }
            }
            return new Arguments(catalog, List.copyOf(timepoints));
        }
    }
}
