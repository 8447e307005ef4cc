package com.enterprise.autosave.repository;

import com.enterprise.autosave.core.DownloadOutcome;
import com.enterprise.autosave.core.ResultSink;
import com.enterprise.autosave.exception.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Result sink that records every attempt, successful or not, as the task's last run
 */
public class RepositoryResultSink implements ResultSink {
    
    private static final Logger logger = LoggerFactory.getLogger(RepositoryResultSink.class);
    
    private final TaskRepository repository;
    
    public RepositoryResultSink(TaskRepository repository) {
        this.repository = repository;
    }
    
    @Override
    public void onResult(long taskId, DownloadOutcome outcome, Instant firedAt) {
        logger.debug("Task {} fired at {} finished: {}", taskId, firedAt, outcome);
        try {
            repository.setLastRun(taskId, firedAt);
        } catch (TaskNotFoundException e) {
            // Deleted while its download was in flight
            logger.info("Task {} no longer exists, dropping outcome {}", taskId, outcome);
        }
    }
}
