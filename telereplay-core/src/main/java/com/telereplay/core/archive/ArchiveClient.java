package com.telereplay.core.archive;

import com.telereplay.core.model.Row;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the remote time-series archive.
 * <p>
 * Calls are blocking and may be slow; callers bound the requested range
 * themselves.
 */
public interface ArchiveClient {

    /**
     * Select rows of one series.
     *
     * @param seriesName Fully qualified series name
     * @param fields     Field names to select, empty for all fields
     * @param start      Range start (inclusive)
     * @param end        Range end (exclusive)
     * @return Rows sorted by timestamp ascending, possibly empty
     * @throws SeriesNotFoundException if the archive has no such series
     * @throws ArchiveException        on any other failure
     */
    List<Row> selectTimeSeries(String seriesName, List<String> fields, Instant start, Instant end)
            throws ArchiveException;
}
