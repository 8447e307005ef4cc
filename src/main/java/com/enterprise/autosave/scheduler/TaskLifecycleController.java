package com.enterprise.autosave.scheduler;

import com.enterprise.autosave.core.DownloadOutcome;
import com.enterprise.autosave.core.DownloadTask;
import com.enterprise.autosave.exception.RecurrenceParseException;
import com.enterprise.autosave.recurrence.RecurrenceDescriptor;
import com.enterprise.autosave.recurrence.RecurrenceParser;
import com.enterprise.autosave.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for everything that changes what is scheduled. The admin interface calls
 * {@link #registerOrReplace} after every create or update, {@link #unregister} before every
 * delete, and process startup calls {@link #reloadAll} once.
 */
public class TaskLifecycleController {
    
    private static final Logger logger = LoggerFactory.getLogger(TaskLifecycleController.class);
    
    private final RecurrenceParser parser;
    private final JobRegistry registry;
    private final SchedulerEngine engine;
    
    public TaskLifecycleController(RecurrenceParser parser, SchedulerEngine engine) {
        this.parser = parser;
        this.engine = engine;
        this.registry = engine.getRegistry();
    }
    
    /**
     * Validate the task's recurrence and schedule it if active, or drop its job if inactive
     */
    public void registerOrReplace(DownloadTask task) throws RecurrenceParseException {
        RecurrenceDescriptor descriptor = parser.parse(task.getRecurrenceExpression());
        if (task.isActive()) {
            registry.upsert(task, descriptor);
        } else if (registry.remove(task.getId())) {
            logger.info("Task {} deactivated", task.getId());
        }
    }
    
    /**
     * Drop the task's pending job. Downloads already running finish and still report.
     */
    public void unregister(long taskId) {
        registry.remove(taskId);
    }
    
    /**
     * Replace the whole schedule with the active tasks given. Tasks with an invalid recurrence
     * are logged and skipped.
     */
    public ReloadReport reloadAll(Collection<DownloadTask> tasks) {
        registry.clearAll();
        
        List<Long> scheduled = new ArrayList<>();
        Map<Long, String> skipped = new LinkedHashMap<>();
        for (DownloadTask task : tasks) {
            if (!task.isActive()) {
                continue;
            }
            try {
                registerOrReplace(task);
                scheduled.add(task.getId());
            } catch (RecurrenceParseException e) {
                logger.warn("Skipping task {} ({}): {}", task.getId(), task.getName(), e.getMessage());
                skipped.put(task.getId(), e.getMessage());
            }
        }
        
        ReloadReport report = new ReloadReport(scheduled, skipped);
        logger.info("Loaded {} active tasks into the scheduler, skipped {}", scheduled.size(), skipped.size());
        return report;
    }
    
    /**
     * Reload from the active tasks of a repository
     */
    public ReloadReport reloadAll(TaskRepository repository) {
        return reloadAll(repository.listActive());
    }
    
    /**
     * Download the task immediately. The task's schedule is left untouched.
     *
     * @throws IllegalArgumentException if {@code taskId} does not identify {@code task}
     */
    public CompletableFuture<DownloadOutcome> runNow(long taskId, DownloadTask task) {
        if (task.getId() != taskId) {
            throw new IllegalArgumentException("Task id " + taskId + " does not match task " + task.getId());
        }
        return engine.runNow(task);
    }
}
