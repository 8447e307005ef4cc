package com.enterprise.autosave.core;

import java.time.Instant;

/**
 * Receives the outcome of every download attempt, scheduled or run on demand.
 * Called exactly once per attempt from a worker thread.
 */
@FunctionalInterface
public interface ResultSink {
    
    /**
     * @param taskId  task the attempt belongs to
     * @param outcome success or failure of the attempt
     * @param firedAt instant the attempt was triggered
     */
    void onResult(long taskId, DownloadOutcome outcome, Instant firedAt);
}
