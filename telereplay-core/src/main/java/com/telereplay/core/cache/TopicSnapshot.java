package com.telereplay.core.cache;

import com.telereplay.core.model.Row;
import com.telereplay.core.model.TopicKind;

/**
 * Current row of a topic after a playback position change.
 *
 * @param row Current row, or null if the topic has no sample at or before the playback time
 */
public record TopicSnapshot(String topic, TopicKind kind, Row row) {
}
