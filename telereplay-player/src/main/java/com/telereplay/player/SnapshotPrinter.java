package com.telereplay.player;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.telereplay.core.cache.TopicSnapshot;
import com.telereplay.core.cache.TopicUpdateListener;
import com.telereplay.core.model.Row;
import com.telereplay.core.model.TopicKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Instant;

/**
 * Writes topic changes as JSON lines:
 * {@code {"time":"...","topic":"thermalData","kind":"TELEMETRY","timestamp":"...","values":{...}}}.
 * A topic without a current row is written with {@code "timestamp":null}.
 */
public class SnapshotPrinter implements TopicUpdateListener {
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotPrinter.class);

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final PrintStream out;
    private volatile Instant playbackTime;

    public SnapshotPrinter(PrintStream out) {
        this.out = out;
    }

    /**
     * Playback time written with the following snapshots.
     */
    public void setPlaybackTime(Instant playbackTime) {
        this.playbackTime = playbackTime;
    }

    @Override
    public void onTopicChanged(TopicSnapshot snapshot) {
        try {
            out.println(format(snapshot));
        } catch (JsonProcessingException e) {
            LOG.error("Cannot write snapshot of {}", snapshot.topic(), e);
        }
    }

    @Override
    public void onTopicRemoved(TopicKind kind, String topic) {
        LOG.info("{} topic {} not available in archive", kind, topic);
    }

    String format(TopicSnapshot snapshot) throws JsonProcessingException {
        ObjectNode node = mapper.createObjectNode();
        node.putPOJO("time", playbackTime);
        node.put("topic", snapshot.topic());
        node.put("kind", snapshot.kind().name());
        Row row = snapshot.row();
        if (row == null) {
            node.putNull("timestamp");
        } else {
            node.putPOJO("timestamp", row.timestamp());
            node.set("values", mapper.valueToTree(row.values()));
        }
        return mapper.writeValueAsString(node);
    }
}
