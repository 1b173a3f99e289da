package com.telereplay.core.model;

/**
 * Kind of an archived topic. Determines the series name prefix and how wide a
 * single archive call may be.
 */
public enum TopicKind {
    /** Periodic, high-rate telemetry */
    TELEMETRY(""),

    /** Sparse discrete events */
    EVENT("logevent_");

    private final String seriesPrefix;

    TopicKind(String seriesPrefix) {
        this.seriesPrefix = seriesPrefix;
    }

    /**
     * Prefix prepended to the topic name in the archive series name.
     */
    public String getSeriesPrefix() {
        return seriesPrefix;
    }
}
