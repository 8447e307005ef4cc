package com.enterprise.autosave.repository;

import com.enterprise.autosave.core.DownloadTask;
import com.enterprise.autosave.core.TaskFields;
import com.enterprise.autosave.exception.TaskNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent store of download tasks. The scheduler reads tasks at startup and only ever
 * writes {@code lastRunAt}, through {@link #setLastRun}.
 */
public interface TaskRepository {
    
    /**
     * Get a task by id
     */
    Optional<DownloadTask> get(long id);
    
    /**
     * All tasks, newest first
     */
    List<DownloadTask> list();
    
    /**
     * Tasks whose status is ACTIVE, newest first
     */
    List<DownloadTask> listActive();
    
    /**
     * Persist a new task and assign its id
     */
    DownloadTask create(TaskFields fields);
    
    /**
     * Replace the editable fields of an existing task
     */
    DownloadTask update(long id, TaskFields fields) throws TaskNotFoundException;
    
    /**
     * Delete a task
     *
     * @return whether the task existed
     */
    boolean delete(long id);
    
    /**
     * Record the instant of the latest run attempt
     */
    void setLastRun(long id, Instant lastRunAt) throws TaskNotFoundException;
}
