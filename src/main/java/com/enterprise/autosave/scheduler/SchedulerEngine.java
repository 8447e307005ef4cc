package com.enterprise.autosave.scheduler;

import com.enterprise.autosave.config.AutoSaveConfig;
import com.enterprise.autosave.core.DownloadOutcome;
import com.enterprise.autosave.core.DownloadTask;
import com.enterprise.autosave.core.FailureReason;
import com.enterprise.autosave.core.FilenameTemplate;
import com.enterprise.autosave.core.ResultSink;
import com.enterprise.autosave.download.DownloadExecutor;
import com.enterprise.autosave.monitoring.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives time for the download scheduler.
 *
 * <p>A single dispatch thread sleeps until the earliest job in the {@link JobRegistry} is due
 * (or the registry changes), fires every due job and goes back to sleep. Firing only hands the
 * download to the worker pool, so a slow download never delays other jobs. Downloads of the
 * same task are chained one after another; different tasks run in parallel. Every attempt
 * ends with exactly one {@link ResultSink} call.
 */
public class SchedulerEngine {
    
    private static final Logger logger = LoggerFactory.getLogger(SchedulerEngine.class);
    
    private final JobRegistry registry;
    private final DownloadExecutor downloadExecutor;
    private final ResultSink resultSink;
    private final MetricsCollector metricsCollector;
    private final Clock clock;
    private final ZoneId zone;
    private final Path downloadRoot;
    private final Duration downloadTimeout;
    private final Duration idlePollInterval;
    private final Duration shutdownTimeout;
    private final ThreadPoolExecutor workers;
    private final Map<Long, CompletableFuture<Void>> executionChains = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    
    private Thread dispatchThread;
    
    public SchedulerEngine(JobRegistry registry, DownloadExecutor downloadExecutor, ResultSink resultSink,
                           AutoSaveConfig config, Clock clock, MetricsCollector metricsCollector) {
        this.registry = registry;
        this.downloadExecutor = downloadExecutor;
        this.resultSink = resultSink;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
        this.zone = config.getSchedulerConfig().getZoneId();
        this.downloadRoot = config.getDownloadConfig().getDownloadRootPath();
        this.downloadTimeout = config.getDownloadConfig().getTimeout();
        this.idlePollInterval = config.getSchedulerConfig().getIdlePollInterval();
        
        AutoSaveConfig.ExecutorConfig executorConfig = config.getExecutorConfig();
        this.shutdownTimeout = executorConfig.getShutdownTimeout();
        this.workers = new ThreadPoolExecutor(
            executorConfig.getCorePoolSize(),
            executorConfig.getMaximumPoolSize(),
            executorConfig.getKeepAliveTime().toMillis(),
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(executorConfig.getQueueCapacity()),
            new WorkerThreadFactory(),
            new DownloadRejectedExecutionHandler()
        );
        
        logger.info("SchedulerEngine initialized with zone={}, workers={}-{}, timeout={}",
                   zone, executorConfig.getCorePoolSize(), executorConfig.getMaximumPoolSize(), downloadTimeout);
    }
    
    /**
     * Start the dispatch loop
     */
    public void start() {
        if (terminated.get()) {
            throw new IllegalStateException("SchedulerEngine has been shut down");
        }
        if (running.compareAndSet(false, true)) {
            dispatchThread = new Thread(this::dispatchLoop, "autosave-dispatcher");
            dispatchThread.setDaemon(false);
            dispatchThread.start();
            logger.info("SchedulerEngine started with {} scheduled jobs", registry.size());
        }
    }
    
    /**
     * Stop the dispatch loop and drain in-flight downloads. Downloads still running after
     * the configured shutdown timeout are interrupted.
     */
    public CompletableFuture<Void> shutdown() {
        return CompletableFuture.runAsync(() -> {
            if (!terminated.compareAndSet(false, true)) {
                return;
            }
            logger.info("Shutting down SchedulerEngine...");
            running.set(false);
            registry.wakeUp();
            
            try {
                if (dispatchThread != null) {
                    dispatchThread.join(shutdownTimeout.toMillis());
                }
                
                workers.shutdown();
                if (!workers.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Downloads did not finish within {}, cancelling {} in flight",
                               shutdownTimeout, workers.getActiveCount());
                    workers.shutdownNow();
                }
                logger.info("SchedulerEngine shutdown completed");
                
            } catch (InterruptedException e) {
                logger.error("Interrupted during shutdown", e);
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        });
    }
    
    public boolean isRunning() {
        return running.get();
    }
    
    public JobRegistry getRegistry() {
        return registry;
    }
    
    /**
     * Fire every job due at the engine clock's current instant
     *
     * @return number of jobs fired
     */
    public int dispatchDue() {
        return registry.fireDue(clock.instant(), this::dispatchScheduled);
    }
    
    /**
     * Run a task's download right away, outside its schedule. Runs are not chained with
     * scheduled executions of the same task.
     */
    public CompletableFuture<DownloadOutcome> runNow(DownloadTask task) {
        if (terminated.get()) {
            throw new IllegalStateException("SchedulerEngine has been shut down");
        }
        Instant firedAt = clock.instant();
        if (metricsCollector != null) {
            metricsCollector.recordRunNow(task.getId());
        }
        logger.info("Running task {} ({}) on demand", task.getId(), task.getName());
        
        try {
            return CompletableFuture.supplyAsync(() -> runAndReport(task, firedAt), workers);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(reportRejected(task, firedAt));
        }
    }
    
    private void dispatchLoop() {
        logger.info("Dispatch loop started");
        while (running.get()) {
            try {
                int fired = dispatchDue();
                if (fired > 0) {
                    logger.debug("Dispatched {} jobs", fired);
                }
            } catch (RuntimeException e) {
                logger.error("Error dispatching due jobs", e);
            }
            
            try {
                registry.awaitNextFire(idlePollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.info("Dispatch loop stopped");
    }
    
    // Runs under the registry lock: only links the execution into the task's chain
    private void dispatchScheduled(ScheduledJob job, Instant scheduledFor) {
        DownloadTask task = job.getTask();
        Instant firedAt = clock.instant();
        if (metricsCollector != null) {
            metricsCollector.recordFire(task.getId());
        }
        logger.debug("Firing task {} scheduled for {}, next fire at {}",
                    task.getId(), scheduledFor, job.getNextFireAt());
        
        CompletableFuture<Void> next = new CompletableFuture<>();
        CompletableFuture<Void> previous = executionChains.put(task.getId(), next);
        CompletableFuture<Void> predecessor = previous != null ? previous : CompletableFuture.completedFuture(null);
        
        predecessor.whenComplete((ignored, error) -> submitChained(task, firedAt, next));
        next.whenComplete((ignored, error) -> executionChains.remove(task.getId(), next));
    }
    
    private void submitChained(DownloadTask task, Instant firedAt, CompletableFuture<Void> done) {
        try {
            workers.execute(() -> {
                try {
                    runAndReport(task, firedAt);
                } finally {
                    done.complete(null);
                }
            });
        } catch (RejectedExecutionException e) {
            reportRejected(task, firedAt);
            done.complete(null);
        }
    }
    
    private DownloadOutcome runAndReport(DownloadTask task, Instant firedAt) {
        if (metricsCollector != null) {
            metricsCollector.recordDownloadStarted();
        }
        
        DownloadOutcome outcome;
        Path outputPath = null;
        try {
            outputPath = FilenameTemplate.resolve(downloadRoot, task.getFilenameTemplate(),
                                                  LocalDate.ofInstant(clock.instant(), zone));
            outcome = downloadExecutor.execute(task.getTargetUrl(), outputPath, downloadTimeout);
        } catch (IllegalArgumentException e) {
            outcome = DownloadOutcome.failure(outputPath, FailureReason.storage(e.getMessage()), 0);
        } catch (RuntimeException e) {
            logger.error("Unexpected error downloading task {}", task.getId(), e);
            outcome = DownloadOutcome.failure(outputPath,
                FailureReason.internal(e.getClass().getSimpleName() + ": " + e.getMessage()), 0);
        }
        
        if (metricsCollector != null) {
            metricsCollector.recordOutcome(outcome);
        }
        if (outcome.isSuccess()) {
            logger.info("Downloaded task {} ({}) -> {} [{} bytes, {}ms]", task.getId(), task.getName(),
                       outcome.getOutputPath(), outcome.getBytesWritten(), outcome.getDurationMs());
        } else {
            logger.warn("Download failed for task {} ({}): {}", task.getId(), task.getName(),
                       outcome.getFailureReason());
        }
        
        report(task.getId(), outcome, firedAt);
        return outcome;
    }
    
    private DownloadOutcome reportRejected(DownloadTask task, Instant firedAt) {
        logger.error("Download of task {} rejected - worker pool is saturated", task.getId());
        DownloadOutcome outcome = DownloadOutcome.failure(null,
            FailureReason.internal("Rejected: worker pool is saturated"), 0);
        report(task.getId(), outcome, firedAt);
        return outcome;
    }
    
    private void report(long taskId, DownloadOutcome outcome, Instant firedAt) {
        try {
            resultSink.onResult(taskId, outcome, firedAt);
        } catch (RuntimeException e) {
            logger.error("Result sink failed for task {}", taskId, e);
        }
    }
    
    /**
     * Thread factory for download worker threads
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicLong threadNumber = new AtomicLong(1);
        private final String namePrefix = "download-worker-";
        
        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(false);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        }
    }
    
    /**
     * Rejected execution handler that logs before refusing the download
     */
    private static class DownloadRejectedExecutionHandler implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            logger.error("Download rejected - worker pool and queue are full or shut down");
            throw new RejectedExecutionException("Download rejected - worker pool saturated");
        }
    }
}
