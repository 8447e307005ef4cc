package com.enterprise.autosave.monitoring;

import com.enterprise.autosave.config.AutoSaveConfig;
import com.enterprise.autosave.download.DownloadExecutor;
import com.enterprise.autosave.scheduler.JobRegistry;
import com.enterprise.autosave.scheduler.SchedulerEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

class HealthCheckerTest {
    
    @TempDir
    Path tempDir;
    
    private DownloadExecutor downloadExecutor;
    private SchedulerEngine engine;
    private MetricsCollector metricsCollector;
    
    @BeforeEach
    void setUp() {
        AutoSaveConfig config = AutoSaveConfig.builder()
            .downloadConfig(new AutoSaveConfig.DownloadConfig(
                tempDir.toString(), Duration.ofSeconds(5), Duration.ofSeconds(2), "test"))
            .build();
        downloadExecutor = new DownloadExecutor(Duration.ofSeconds(2), "test");
        metricsCollector = new MetricsCollector(new SimpleMeterRegistry());
        engine = new SchedulerEngine(new JobRegistry(Clock.systemUTC()), downloadExecutor,
            (taskId, outcome, firedAt) -> { }, config, Clock.systemUTC(), metricsCollector);
    }
    
    @AfterEach
    void tearDown() throws Exception {
        engine.shutdown().get(10, TimeUnit.SECONDS);
        downloadExecutor.close();
    }
    
    @Test
    void testStoppedEngineIsUnhealthy() {
        HealthChecker.HealthStatus status = new HealthChecker(engine, tempDir, metricsCollector).check();
        
        assertFalse(status.isHealthy());
        assertFalse(status.getChecks().get("engine.running").isPassed());
        assertTrue(status.getFailedChecks().containsKey("engine.running"));
    }
    
    @Test
    void testRunningEngineIsHealthy() throws Exception {
        engine.start();
        
        HealthChecker.HealthStatus status = new HealthChecker(engine, tempDir.resolve("not-yet-created"),
                                                              metricsCollector)
            .performHealthCheck().get(5, TimeUnit.SECONDS);
        
        assertTrue(status.getChecks().get("engine.running").isPassed());
        assertTrue(status.getChecks().get("download.root").isPassed());
        assertTrue(status.getChecks().containsKey("jobs.scheduled"));
        assertTrue(status.getChecks().containsKey("downloads.in_flight"));
        assertNotNull(status.getTimestamp());
    }
    
    @Test
    void testDownloadRootBlockedByFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("plain-file"), "x");
        
        HealthChecker.HealthStatus status = new HealthChecker(engine, file.resolve("downloads"), null).check();
        
        assertFalse(status.getChecks().get("download.root").isPassed());
        assertFalse(status.getChecks().containsKey("downloads.in_flight"));
    }
}
