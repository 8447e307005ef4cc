package com.enterprise.autosave;

import com.enterprise.autosave.config.AutoSaveConfig;
import com.enterprise.autosave.config.ConfigValidator;
import com.enterprise.autosave.core.DownloadOutcome;
import com.enterprise.autosave.core.DownloadTask;
import com.enterprise.autosave.core.TaskFields;
import com.enterprise.autosave.download.DownloadExecutor;
import com.enterprise.autosave.exception.RecurrenceParseException;
import com.enterprise.autosave.exception.TaskNotFoundException;
import com.enterprise.autosave.monitoring.HealthChecker;
import com.enterprise.autosave.monitoring.MetricsCollector;
import com.enterprise.autosave.recurrence.RecurrenceParser;
import com.enterprise.autosave.repository.MapDBTaskRepository;
import com.enterprise.autosave.repository.RepositoryResultSink;
import com.enterprise.autosave.repository.TaskRepository;
import com.enterprise.autosave.scheduler.JobRegistry;
import com.enterprise.autosave.scheduler.ReloadReport;
import com.enterprise.autosave.scheduler.SchedulerEngine;
import com.enterprise.autosave.scheduler.TaskLifecycleController;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Factory for creating and wiring the download scheduler
 */
public class AutoSaveEngineFactory {
    
    private static final Logger logger = LoggerFactory.getLogger(AutoSaveEngineFactory.class);
    
    /**
     * Create a service with default configuration
     */
    public static AutoSaveService createDefault() {
        return create(AutoSaveConfig.builder().build());
    }
    
    /**
     * Create a service backed by the MapDB repository described in the configuration
     */
    public static AutoSaveService create(AutoSaveConfig config) {
        validate(config);
        AutoSaveConfig.RepositoryConfig repositoryConfig = config.getRepositoryConfig();
        MapDBTaskRepository repository = repositoryConfig.isInMemory()
            ? MapDBTaskRepository.inMemory()
            : MapDBTaskRepository.open(repositoryConfig.getDbPath());
        return build(config, repository, true, Clock.systemUTC());
    }
    
    /**
     * Create a service over an externally managed repository
     */
    public static AutoSaveService create(AutoSaveConfig config, TaskRepository repository) {
        return create(config, repository, Clock.systemUTC());
    }
    
    /**
     * Create a service over an externally managed repository, reading time from {@code clock}
     */
    public static AutoSaveService create(AutoSaveConfig config, TaskRepository repository, Clock clock) {
        validate(config);
        return build(config, repository, false, clock);
    }
    
    private static void validate(AutoSaveConfig config) {
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);
        
        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }
    }
    
    private static AutoSaveService build(AutoSaveConfig config, TaskRepository repository,
                                         boolean ownsRepository, Clock clock) {
        logger.info("Creating AutoSaveService with configuration: {}", config);
        
        AutoSaveConfig.DownloadConfig downloadConfig = config.getDownloadConfig();
        MetricsCollector metricsCollector = config.getMonitoringConfig().isEnableMetrics()
            ? new MetricsCollector(new SimpleMeterRegistry())
            : null;
        
        RecurrenceParser parser = new RecurrenceParser(config.getSchedulerConfig().getZoneId());
        JobRegistry registry = new JobRegistry(clock);
        DownloadExecutor downloadExecutor = new DownloadExecutor(downloadConfig.getConnectTimeout(),
                                                                 downloadConfig.getUserAgent());
        SchedulerEngine engine = new SchedulerEngine(registry, downloadExecutor,
            new RepositoryResultSink(repository), config, clock, metricsCollector);
        TaskLifecycleController controller = new TaskLifecycleController(parser, engine);
        HealthChecker healthChecker = new HealthChecker(engine, downloadConfig.getDownloadRootPath(),
                                                        metricsCollector);
        
        if (metricsCollector != null) {
            metricsCollector.bindScheduledJobs(registry::size);
        }
        
        logger.info("AutoSaveService created successfully");
        return new AutoSaveService(parser, controller, engine, downloadExecutor, repository,
                                   ownsRepository, metricsCollector, healthChecker);
    }
    
    /**
     * The wired scheduler together with the task operations an admin front end needs
     */
    public static class AutoSaveService {
        private final RecurrenceParser parser;
        private final TaskLifecycleController controller;
        private final SchedulerEngine engine;
        private final DownloadExecutor downloadExecutor;
        private final TaskRepository repository;
        private final boolean ownsRepository;
        private final MetricsCollector metricsCollector;
        private final HealthChecker healthChecker;
        // Keeps each persist and schedule pair atomic against the others
        private final ReentrantLock taskLock = new ReentrantLock();
        
        AutoSaveService(RecurrenceParser parser, TaskLifecycleController controller, SchedulerEngine engine,
                        DownloadExecutor downloadExecutor, TaskRepository repository, boolean ownsRepository,
                        MetricsCollector metricsCollector, HealthChecker healthChecker) {
            this.parser = parser;
            this.controller = controller;
            this.engine = engine;
            this.downloadExecutor = downloadExecutor;
            this.repository = repository;
            this.ownsRepository = ownsRepository;
            this.metricsCollector = metricsCollector;
            this.healthChecker = healthChecker;
        }
        
        public TaskLifecycleController getController() { return controller; }
        public SchedulerEngine getEngine() { return engine; }
        public JobRegistry getRegistry() { return engine.getRegistry(); }
        public TaskRepository getRepository() { return repository; }
        public MetricsCollector getMetricsCollector() { return metricsCollector; }
        public HealthChecker getHealthChecker() { return healthChecker; }
        
        /**
         * Load every active task into the schedule and start dispatching
         */
        public ReloadReport start() {
            ReloadReport report;
            taskLock.lock();
            try {
                report = controller.reloadAll(repository);
            } finally {
                taskLock.unlock();
            }
            engine.start();
            return report;
        }
        
        public void stop() {
            engine.shutdown().join();
            downloadExecutor.close();
            if (ownsRepository && repository instanceof MapDBTaskRepository) {
                ((MapDBTaskRepository) repository).close();
            }
        }
        
        public boolean isRunning() {
            return engine.isRunning();
        }
        
        /**
         * Validate the recurrence, persist the task and schedule it
         */
        public DownloadTask createTask(TaskFields fields) throws RecurrenceParseException {
            parser.parse(fields.getRecurrenceExpression());
            taskLock.lock();
            try {
                DownloadTask task = repository.create(fields);
                controller.registerOrReplace(task);
                return task;
            } finally {
                taskLock.unlock();
            }
        }
        
        /**
         * Validate the recurrence, persist the new fields and reschedule
         */
        public DownloadTask updateTask(long taskId, TaskFields fields)
                throws RecurrenceParseException, TaskNotFoundException {
            parser.parse(fields.getRecurrenceExpression());
            taskLock.lock();
            try {
                DownloadTask task = repository.update(taskId, fields);
                controller.registerOrReplace(task);
                return task;
            } finally {
                taskLock.unlock();
            }
        }
        
        /**
         * Unschedule and delete a task. A download already running still completes.
         */
        public boolean deleteTask(long taskId) {
            taskLock.lock();
            try {
                controller.unregister(taskId);
                return repository.delete(taskId);
            } finally {
                taskLock.unlock();
            }
        }
        
        /**
         * Download a stored task right away
         */
        public CompletableFuture<DownloadOutcome> runNow(long taskId) throws TaskNotFoundException {
            DownloadTask task = repository.get(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
            return controller.runNow(taskId, task);
        }
    }
}
