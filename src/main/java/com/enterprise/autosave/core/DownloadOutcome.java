package com.enterprise.autosave.core;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Result of one download attempt. Failures are carried as data, never thrown.
 */
public final class DownloadOutcome {
    
    private final boolean success;
    private final Path outputPath;
    private final long bytesWritten;
    private final FailureReason failureReason;
    private final long durationMs;
    private final Instant completedAt;
    
    private DownloadOutcome(boolean success, Path outputPath, long bytesWritten,
                            FailureReason failureReason, long durationMs) {
        this.success = success;
        this.outputPath = outputPath;
        this.bytesWritten = bytesWritten;
        this.failureReason = failureReason;
        this.durationMs = durationMs;
        this.completedAt = Instant.now();
    }
    
    /**
     * Creates a successful outcome
     */
    public static DownloadOutcome success(Path outputPath, long bytesWritten, long durationMs) {
        return new DownloadOutcome(true, outputPath, bytesWritten, null, durationMs);
    }
    
    /**
     * Creates a failed outcome
     */
    public static DownloadOutcome failure(Path outputPath, FailureReason reason, long durationMs) {
        return new DownloadOutcome(false, outputPath, 0, reason, durationMs);
    }
    
    public boolean isSuccess() { return success; }
    public Path getOutputPath() { return outputPath; }
    public long getBytesWritten() { return bytesWritten; }
    
    /**
     * Failure reason, null for successful outcomes
     */
    public FailureReason getFailureReason() { return failureReason; }
    
    public long getDurationMs() { return durationMs; }
    public Instant getCompletedAt() { return completedAt; }
    
    @Override
    public String toString() {
        return success
            ? "Success{" + outputPath + ", " + bytesWritten + " bytes, " + durationMs + "ms}"
            : "Failure{" + failureReason + ", " + durationMs + "ms}";
    }
}
