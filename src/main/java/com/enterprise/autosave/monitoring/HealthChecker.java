package com.enterprise.autosave.monitoring;

import com.enterprise.autosave.scheduler.SchedulerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Health checker for the download scheduler
 */
public class HealthChecker {
    
    private static final Logger logger = LoggerFactory.getLogger(HealthChecker.class);
    
    private final SchedulerEngine engine;
    private final Path downloadRoot;
    private final MetricsCollector metricsCollector;
    
    public HealthChecker(SchedulerEngine engine, Path downloadRoot, MetricsCollector metricsCollector) {
        this.engine = engine;
        this.downloadRoot = downloadRoot;
        this.metricsCollector = metricsCollector;
    }
    
    public CompletableFuture<HealthStatus> performHealthCheck() {
        return CompletableFuture.supplyAsync(this::check);
    }
    
    /**
     * Run every check on the calling thread
     */
    public HealthStatus check() {
        HealthStatus.Builder builder = HealthStatus.builder();
        
        checkEngineStatus(builder);
        checkDownloadRoot(builder);
        checkSystemResources(builder);
        
        HealthStatus status = builder.build();
        if (!status.isHealthy()) {
            logger.warn("Health check failed: {}", status.getFailedChecks());
        }
        return status;
    }
    
    private void checkEngineStatus(HealthStatus.Builder builder) {
        boolean isRunning = engine.isRunning();
        builder.addCheck("engine.running", isRunning,
            isRunning ? "Scheduler is running" : "Scheduler is not running");
        
        int scheduled = engine.getRegistry().size();
        builder.addCheck("jobs.scheduled", true, String.format("Scheduled jobs: %d", scheduled));
        
        if (metricsCollector != null) {
            builder.addCheck("downloads.in_flight", true,
                String.format("Downloads in flight: %d", metricsCollector.getInFlight()));
        }
    }
    
    private void checkDownloadRoot(HealthStatus.Builder builder) {
        // The root is created lazily by the first download
        Path existing = downloadRoot.toAbsolutePath();
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        boolean writable = existing != null && Files.isDirectory(existing) && Files.isWritable(existing);
        builder.addCheck("download.root", writable,
            String.format("Download root %s is %s", downloadRoot, writable ? "writable" : "not writable"));
    }
    
    private void checkSystemResources(HealthStatus.Builder builder) {
        Runtime runtime = Runtime.getRuntime();
        long maxMemory = runtime.maxMemory();
        long usedMemory = runtime.totalMemory() - runtime.freeMemory();
        double memoryUsagePercent = (double) usedMemory / maxMemory * 100;
        
        boolean memoryHealthy = memoryUsagePercent < 90;
        builder.addCheck("system.memory", memoryHealthy,
            String.format("Memory usage: %.2f%% (%d/%d MB)",
                memoryUsagePercent, usedMemory / 1024 / 1024, maxMemory / 1024 / 1024));
    }
    
    /**
     * Health status result
     */
    public static class HealthStatus {
        private final boolean healthy;
        private final Map<String, CheckResult> checks;
        private final Instant timestamp;
        
        private HealthStatus(boolean healthy, Map<String, CheckResult> checks, Instant timestamp) {
            this.healthy = healthy;
            this.checks = checks;
            this.timestamp = timestamp;
        }
        
        public boolean isHealthy() { return healthy; }
        public Map<String, CheckResult> getChecks() { return checks; }
        public Instant getTimestamp() { return timestamp; }
        
        public Map<String, String> getFailedChecks() {
            Map<String, String> failed = new ConcurrentHashMap<>();
            checks.forEach((name, result) -> {
                if (!result.isPassed()) {
                    failed.put(name, result.getMessage());
                }
            });
            return failed;
        }
        
        public static class CheckResult {
            private final boolean passed;
            private final String message;
            
            public CheckResult(boolean passed, String message) {
                this.passed = passed;
                this.message = message;
            }
            
            public boolean isPassed() { return passed; }
            public String getMessage() { return message; }
        }
        
        public static class Builder {
            private final Map<String, CheckResult> checks = new ConcurrentHashMap<>();
            
            public Builder addCheck(String name, boolean passed, String message) {
                checks.put(name, new CheckResult(passed, message));
                return this;
            }
            
            public HealthStatus build() {
                boolean healthy = checks.values().stream().allMatch(CheckResult::isPassed);
                return new HealthStatus(healthy, checks, Instant.now());
            }
        }
        
        public static Builder builder() {
            return new Builder();
        }
    }
}
