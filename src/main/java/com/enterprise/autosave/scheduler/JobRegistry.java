package com.enterprise.autosave.scheduler;

import com.enterprise.autosave.core.DownloadTask;
import com.enterprise.autosave.recurrence.RecurrenceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

/**
 * Table of live jobs keyed by task id.
 *
 * <p>Every mutation and every fire happens under one lock, so there is at most one live job per
 * task id, and a job removed here can never be fired afterwards. The dispatch loop of
 * {@link SchedulerEngine} waits on this registry and is woken whenever the table changes.
 */
public class JobRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(JobRegistry.class);
    
    private final Clock clock;
    private final Map<Long, ScheduledJob> jobs = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean changePending;
    
    public JobRegistry(Clock clock) {
        this.clock = clock;
    }
    
    /**
     * Replace any job for the task with a fresh one scheduled from now
     */
    public ScheduledJob upsert(DownloadTask task, RecurrenceDescriptor descriptor) {
        lock.lock();
        try {
            Instant now = clock.instant();
            ScheduledJob job = new ScheduledJob(task, descriptor, descriptor.nextFireAfter(now), now);
            ScheduledJob previous = jobs.put(task.getId(), job);
            if (previous != null) {
                previous.cancel();
                logger.info("Replaced job for task {} ({}), next fire at {}",
                           task.getId(), descriptor.getExpression(), job.getNextFireAt());
            } else {
                logger.info("Scheduled job for task {} ({}), next fire at {}",
                           task.getId(), descriptor.getExpression(), job.getNextFireAt());
            }
            signalChange();
            return job;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Cancel and remove the job for a task. Unknown ids are ignored.
     *
     * @return whether a job was removed
     */
    public boolean remove(long taskId) {
        lock.lock();
        try {
            ScheduledJob removed = jobs.remove(taskId);
            if (removed == null) {
                return false;
            }
            removed.cancel();
            signalChange();
            logger.info("Removed job for task {}", taskId);
            return true;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Remove every job
     *
     * @return number of jobs removed
     */
    public int clearAll() {
        lock.lock();
        try {
            int count = jobs.size();
            jobs.values().forEach(ScheduledJob::cancel);
            jobs.clear();
            signalChange();
            logger.info("Cleared {} scheduled jobs", count);
            return count;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * All jobs ordered by next fire instant, then task id
     */
    public List<JobSnapshot> snapshot() {
        lock.lock();
        try {
            List<JobSnapshot> result = new ArrayList<>(jobs.size());
            for (ScheduledJob job : jobs.values()) {
                result.add(new JobSnapshot(job.getTaskId(), job.getNextFireAt(), job.getDescriptor().getExpression()));
            }
            result.sort(Comparator.comparing(JobSnapshot::getNextFireAt).thenComparingLong(JobSnapshot::getTaskId));
            return result;
        } finally {
            lock.unlock();
        }
    }
    
    public Optional<Instant> nextFireAt(long taskId) {
        lock.lock();
        try {
            ScheduledJob job = jobs.get(taskId);
            return job != null ? Optional.of(job.getNextFireAt()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }
    
    public boolean contains(long taskId) {
        lock.lock();
        try {
            return jobs.containsKey(taskId);
        } finally {
            lock.unlock();
        }
    }
    
    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Fire every job due at {@code now}. Each job's next fire instant is advanced past
     * {@code now} before {@code dispatcher} sees it, so a job that is overdue by several
     * occurrences fires exactly once. The dispatcher runs under the registry lock and must
     * hand work off without blocking.
     *
     * @return number of jobs fired
     */
    int fireDue(Instant now, BiConsumer<ScheduledJob, Instant> dispatcher) {
        lock.lock();
        try {
            int fired = 0;
            for (ScheduledJob job : jobs.values()) {
                if (!job.isDue(now)) {
                    continue;
                }
                Instant scheduledFor = job.getNextFireAt();
                job.advance(job.getDescriptor().nextFireAfter(now));
                try {
                    dispatcher.accept(job, scheduledFor);
                    fired++;
                } catch (RuntimeException e) {
                    logger.error("Failed to dispatch task {} scheduled for {}", job.getTaskId(), scheduledFor, e);
                }
            }
            return fired;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Block until the earliest job is due, the table changes, or {@code maxIdle} elapses
     */
    void awaitNextFire(Duration maxIdle) throws InterruptedException {
        lock.lock();
        try {
            if (changePending) {
                changePending = false;
                return;
            }
            long waitNanos = maxIdle.toNanos();
            Instant now = clock.instant();
            for (ScheduledJob job : jobs.values()) {
                waitNanos = Math.min(waitNanos, Duration.between(now, job.getNextFireAt()).toNanos());
            }
            if (waitNanos > 0) {
                changed.await(waitNanos, TimeUnit.NANOSECONDS);
            }
            changePending = false;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Wake the dispatch loop without changing the table
     */
    void wakeUp() {
        lock.lock();
        try {
            signalChange();
        } finally {
            lock.unlock();
        }
    }
    
    private void signalChange() {
        changePending = true;
        changed.signalAll();
    }
}
