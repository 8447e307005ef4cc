package com.enterprise.autosave.exception;

/**
 * Exception thrown when a requested download task is not found
 */
public class TaskNotFoundException extends AutoSaveException {
    
    private final long taskId;
    
    public TaskNotFoundException(long taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }
    
    public long getTaskId() {
        return taskId;
    }
}
