package com.telereplay.core.cache;

import com.telereplay.core.model.TopicKind;

/**
 * Listener for topic changes in a {@link TopicCacheRegistry}.
 */
public interface TopicUpdateListener {
    /**
     * Called when the current row of a topic changed on refresh.
     */
    void onTopicChanged(TopicSnapshot snapshot);

    /**
     * Called when a topic was removed because the archive has no series for it.
     */
    default void onTopicRemoved(TopicKind kind, String topic) {}
}
