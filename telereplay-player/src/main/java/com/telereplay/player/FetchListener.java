package com.telereplay.player;

import com.telereplay.core.cache.FetchOutcome;
import com.telereplay.core.cache.FetchRequest;

import java.time.Duration;

/**
 * Progress of fetch requests executed by a {@link Player}.
 * Called from worker threads.
 */
public interface FetchListener {

    void onRequestStarted(FetchRequest request, int worker);

    /**
     * @param outcome Result of the request, {@link FetchOutcome#FAILED} for unexpected exceptions too
     */
    void onRequestFinished(FetchRequest request, int worker, FetchOutcome outcome, Duration elapsed);
}
