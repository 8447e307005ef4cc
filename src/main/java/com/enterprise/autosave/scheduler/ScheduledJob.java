package com.enterprise.autosave.scheduler;

import com.enterprise.autosave.core.DownloadTask;
import com.enterprise.autosave.recurrence.RecurrenceDescriptor;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A live binding of a task snapshot to its recurrence and next fire instant.
 * Owned by {@link JobRegistry}; the next fire instant only moves under the registry lock.
 */
public class ScheduledJob {
    
    private final DownloadTask task;
    private final RecurrenceDescriptor descriptor;
    private final Instant createdAt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile Instant nextFireAt;
    
    ScheduledJob(DownloadTask task, RecurrenceDescriptor descriptor, Instant nextFireAt, Instant createdAt) {
        this.task = task;
        this.descriptor = descriptor;
        this.nextFireAt = nextFireAt;
        this.createdAt = createdAt;
    }
    
    public long getTaskId() { return task.getId(); }
    public DownloadTask getTask() { return task; }
    public RecurrenceDescriptor getDescriptor() { return descriptor; }
    public Instant getNextFireAt() { return nextFireAt; }
    public Instant getCreatedAt() { return createdAt; }
    
    public boolean isCancelled() {
        return cancelled.get();
    }
    
    void advance(Instant next) {
        this.nextFireAt = next;
    }
    
    void cancel() {
        cancelled.set(true);
    }
    
    boolean isDue(Instant now) {
        return !nextFireAt.isAfter(now);
    }
    
    @Override
    public String toString() {
        return "ScheduledJob{" +
                "taskId=" + task.getId() +
                ", expression='" + descriptor.getExpression() + '\'' +
                ", nextFireAt=" + nextFireAt +
                ", cancelled=" + cancelled.get() +
                '}';
    }
}
