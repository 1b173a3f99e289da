package com.telereplay.core.archive;

/**
 * The archive does not hold the requested series. Permanent for the lifetime of
 * a cache: topics defined in the schema but never published have no series.
 */
public class SeriesNotFoundException extends ArchiveException {
    private final String seriesName;

    public SeriesNotFoundException(String seriesName) {
        super("Series not found in archive: " + seriesName);
        this.seriesName = seriesName;
    }

    public String getSeriesName() {
        return seriesName;
    }
}
