package com.enterprise.autosave.scheduler;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time view of one scheduled job
 */
public final class JobSnapshot {
    
    private final long taskId;
    private final Instant nextFireAt;
    private final String expression;
    
    public JobSnapshot(long taskId, Instant nextFireAt, String expression) {
        this.taskId = taskId;
        this.nextFireAt = nextFireAt;
        this.expression = expression;
    }
    
    public long getTaskId() { return taskId; }
    public Instant getNextFireAt() { return nextFireAt; }
    public String getExpression() { return expression; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobSnapshot that = (JobSnapshot) o;
        return taskId == that.taskId && nextFireAt.equals(that.nextFireAt) && Objects.equals(expression, that.expression);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(taskId, nextFireAt, expression);
    }
    
    @Override
    public String toString() {
        return String.format("%d@%s(%s)", taskId, nextFireAt, expression);
    }
}
