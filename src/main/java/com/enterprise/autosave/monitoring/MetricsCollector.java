package com.enterprise.autosave.monitoring;

import com.enterprise.autosave.core.DownloadOutcome;
import com.enterprise.autosave.core.FailureReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Collects and exposes metrics for scheduled downloads
 */
public class MetricsCollector {
    
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);
    
    private final MeterRegistry meterRegistry;
    
    private final Counter fires;
    private final Counter runNowTriggers;
    private final Counter downloadsSucceeded;
    private final Map<FailureReason.Kind, Counter> downloadsFailed = new EnumMap<>(FailureReason.Kind.class);
    private final Counter bytesDownloaded;
    private final Timer downloadTime;
    
    private final AtomicLong inFlight = new AtomicLong(0);
    
    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        this.fires = Counter.builder("autosave.jobs.fired")
            .description("Total number of scheduled fires")
            .register(meterRegistry);
            
        this.runNowTriggers = Counter.builder("autosave.jobs.run_now")
            .description("Total number of on-demand runs")
            .register(meterRegistry);
            
        this.downloadsSucceeded = Counter.builder("autosave.downloads.succeeded")
            .description("Total number of downloads completed successfully")
            .register(meterRegistry);
        
        for (FailureReason.Kind kind : FailureReason.Kind.values()) {
            downloadsFailed.put(kind, Counter.builder("autosave.downloads.failed")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .description("Total number of failed downloads by failure kind")
                .register(meterRegistry));
        }
        
        this.bytesDownloaded = Counter.builder("autosave.downloads.bytes")
            .description("Total bytes written by successful downloads")
            .baseUnit("bytes")
            .register(meterRegistry);
        
        this.downloadTime = Timer.builder("autosave.download.time")
            .description("Download execution time")
            .register(meterRegistry);
        
        Gauge.builder("autosave.downloads.in_flight", inFlight, AtomicLong::get)
            .description("Number of downloads currently running")
            .register(meterRegistry);
        
        logger.info("MetricsCollector initialized");
    }
    
    /**
     * Expose the number of live jobs as a gauge
     */
    public void bindScheduledJobs(IntSupplier scheduledJobs) {
        Gauge.builder("autosave.jobs.scheduled", scheduledJobs, IntSupplier::getAsInt)
            .description("Number of live scheduled jobs")
            .register(meterRegistry);
    }
    
    public void recordFire(long taskId) {
        fires.increment();
        logger.debug("Recorded fire for task {}", taskId);
    }
    
    public void recordRunNow(long taskId) {
        runNowTriggers.increment();
        logger.debug("Recorded run-now for task {}", taskId);
    }
    
    public void recordDownloadStarted() {
        inFlight.incrementAndGet();
    }
    
    /**
     * Record the end of a download attempt
     */
    public void recordOutcome(DownloadOutcome outcome) {
        inFlight.decrementAndGet();
        downloadTime.record(outcome.getDurationMs(), TimeUnit.MILLISECONDS);
        
        if (outcome.isSuccess()) {
            downloadsSucceeded.increment();
            bytesDownloaded.increment(outcome.getBytesWritten());
        } else {
            downloadsFailed.get(outcome.getFailureReason().getKind()).increment();
        }
    }
    
    public long getInFlight() {
        return inFlight.get();
    }
    
    /**
     * Get all metrics as a map
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();
        
        metrics.put("jobs.fired", fires.count());
        metrics.put("jobs.run_now", runNowTriggers.count());
        metrics.put("downloads.succeeded", downloadsSucceeded.count());
        downloadsFailed.forEach((kind, counter) ->
            metrics.put("downloads.failed." + kind.name().toLowerCase(Locale.ROOT), counter.count()));
        metrics.put("downloads.bytes", bytesDownloaded.count());
        metrics.put("downloads.in_flight", inFlight.get());
        
        metrics.put("download.time.mean", downloadTime.mean(TimeUnit.MILLISECONDS));
        metrics.put("download.time.max", downloadTime.max(TimeUnit.MILLISECONDS));
        
        return metrics;
    }
}
