package com.telereplay.player;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReplayAppTest {

    @Test
    @DisplayName("Timepoints without catalog use the bundled catalog")
    void timepointsOnly() {
        ReplayApp.Arguments arguments = ReplayApp.Arguments.parse(
            new String[]{"2025-05-19T23:40:00Z", "2025-05-19T23:41:30.5Z"});

        assertNull(arguments.catalog());
        assertEquals(List.of(Instant.parse("2025-05-19T23:40:00Z"), Instant.parse("2025-05-19T23:41:30.5Z")),
            arguments.timepoints());
    }

    @Test
    @DisplayName("Leading JSON file is the catalog")
    void catalogFile() {
        ReplayApp.Arguments arguments = ReplayApp.Arguments.parse(
            new String[]{"catalogs/mount.json", "2025-05-19T23:40:00Z"});

        assertEquals(Path.of("catalogs/mount.json"), arguments.catalog());
        assertEquals(1, arguments.timepoints().size());
    }

    @Test
    @DisplayName("Missing or malformed timepoints are rejected")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class,
            () -> ReplayApp.Arguments.parse(new String[]{"mount.json"}));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ReplayApp.Arguments.parse(new String[]{"2025-05-19 23:40"}));
        assertTrue(e.getMessage().contains("2025-05-19 23:40"));
    }
}
