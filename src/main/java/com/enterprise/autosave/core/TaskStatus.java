package com.enterprise.autosave.core;

/**
 * Scheduling status of a download task
 */
public enum TaskStatus {
    ACTIVE,         // Task holds a live job and fires on its recurrence
    INACTIVE        // Task is kept but never fires
}
