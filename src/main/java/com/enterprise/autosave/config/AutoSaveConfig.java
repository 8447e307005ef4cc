package com.enterprise.autosave.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

/**
 * Configuration for the download scheduler
 */
public class AutoSaveConfig {
    
    public static final String PREFIX = "autosave.";
    
    private final SchedulerConfig schedulerConfig;
    private final ExecutorConfig executorConfig;
    private final DownloadConfig downloadConfig;
    private final RepositoryConfig repositoryConfig;
    private final MonitoringConfig monitoringConfig;
    
    public AutoSaveConfig(SchedulerConfig schedulerConfig, ExecutorConfig executorConfig,
                          DownloadConfig downloadConfig, RepositoryConfig repositoryConfig,
                          MonitoringConfig monitoringConfig) {
        this.schedulerConfig = schedulerConfig;
        this.executorConfig = executorConfig;
        this.downloadConfig = downloadConfig;
        this.repositoryConfig = repositoryConfig;
        this.monitoringConfig = monitoringConfig;
    }
    
    public SchedulerConfig getSchedulerConfig() { return schedulerConfig; }
    public ExecutorConfig getExecutorConfig() { return executorConfig; }
    public DownloadConfig getDownloadConfig() { return downloadConfig; }
    public RepositoryConfig getRepositoryConfig() { return repositoryConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }
    
    @Override
    public String toString() {
        return "AutoSaveConfig{" +
                "timezone=" + schedulerConfig.getTimezone() +
                ", downloadRoot=" + downloadConfig.getDownloadRoot() +
                ", downloadTimeout=" + downloadConfig.getTimeout() +
                ", workers=" + executorConfig.getCorePoolSize() + "-" + executorConfig.getMaximumPoolSize() +
                ", dbPath=" + (repositoryConfig.isInMemory() ? "<memory>" : repositoryConfig.getDbPath()) +
                '}';
    }
    
    /**
     * Scheduler configuration
     */
    public static class SchedulerConfig {
        private final String timezone;
        private final Duration idlePollInterval;
        
        public SchedulerConfig(String timezone, Duration idlePollInterval) {
            this.timezone = timezone;
            this.idlePollInterval = idlePollInterval;
        }
        
        /**
         * IANA timezone name applied to every recurrence and to {date} rendering
         */
        public String getTimezone() { return timezone; }
        
        /**
         * Longest time the dispatch loop sleeps without re-reading the clock
         */
        public Duration getIdlePollInterval() { return idlePollInterval; }
        
        public ZoneId getZoneId() {
            return ZoneId.of(timezone);
        }
    }
    
    /**
     * Download worker pool configuration
     */
    public static class ExecutorConfig {
        private final int corePoolSize;
        private final int maximumPoolSize;
        private final Duration keepAliveTime;
        private final int queueCapacity;
        private final Duration shutdownTimeout;
        
        public ExecutorConfig(int corePoolSize, int maximumPoolSize, Duration keepAliveTime, 
                            int queueCapacity, Duration shutdownTimeout) {
            this.corePoolSize = corePoolSize;
            this.maximumPoolSize = maximumPoolSize;
            this.keepAliveTime = keepAliveTime;
            this.queueCapacity = queueCapacity;
            this.shutdownTimeout = shutdownTimeout;
        }
        
        public int getCorePoolSize() { return corePoolSize; }
        public int getMaximumPoolSize() { return maximumPoolSize; }
        public Duration getKeepAliveTime() { return keepAliveTime; }
        public int getQueueCapacity() { return queueCapacity; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
    }
    
    /**
     * Download configuration
     */
    public static class DownloadConfig {
        private final String downloadRoot;
        private final Duration timeout;
        private final Duration connectTimeout;
        private final String userAgent;
        
        public DownloadConfig(String downloadRoot, Duration timeout, Duration connectTimeout, String userAgent) {
            this.downloadRoot = downloadRoot;
            this.timeout = timeout;
            this.connectTimeout = connectTimeout;
            this.userAgent = userAgent;
        }
        
        public String getDownloadRoot() { return downloadRoot; }
        public Duration getTimeout() { return timeout; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public String getUserAgent() { return userAgent; }
        
        public Path getDownloadRootPath() {
            return Paths.get(downloadRoot);
        }
    }
    
    /**
     * Task repository configuration
     */
    public static class RepositoryConfig {
        private final String dbPath;
        private final boolean inMemory;
        
        public RepositoryConfig(String dbPath, boolean inMemory) {
            this.dbPath = dbPath;
            this.inMemory = inMemory;
        }
        
        public String getDbPath() { return dbPath; }
        public boolean isInMemory() { return inMemory; }
    }
    
    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        
        public MonitoringConfig(boolean enableMetrics) {
            this.enableMetrics = enableMetrics;
        }
        
        public boolean isEnableMetrics() { return enableMetrics; }
    }
    
    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private SchedulerConfig schedulerConfig = Defaults.defaultSchedulerConfig();
        private ExecutorConfig executorConfig = Defaults.defaultExecutorConfig();
        private DownloadConfig downloadConfig = Defaults.defaultDownloadConfig();
        private RepositoryConfig repositoryConfig = Defaults.defaultRepositoryConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();
        
        public Builder schedulerConfig(SchedulerConfig schedulerConfig) {
            this.schedulerConfig = schedulerConfig;
            return this;
        }
        
        public Builder executorConfig(ExecutorConfig executorConfig) {
            this.executorConfig = executorConfig;
            return this;
        }
        
        public Builder downloadConfig(DownloadConfig downloadConfig) {
            this.downloadConfig = downloadConfig;
            return this;
        }
        
        public Builder repositoryConfig(RepositoryConfig repositoryConfig) {
            this.repositoryConfig = repositoryConfig;
            return this;
        }
        
        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }
        
        public AutoSaveConfig build() {
            return new AutoSaveConfig(schedulerConfig, executorConfig, downloadConfig,
                                      repositoryConfig, monitoringConfig);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Build a configuration from {@code autosave.*} properties; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a numeric property cannot be parsed
     */
    public static AutoSaveConfig fromProperties(Properties properties) {
        SchedulerConfig scheduler = Defaults.defaultSchedulerConfig();
        ExecutorConfig executor = Defaults.defaultExecutorConfig();
        DownloadConfig download = Defaults.defaultDownloadConfig();
        RepositoryConfig repository = Defaults.defaultRepositoryConfig();
        MonitoringConfig monitoring = Defaults.defaultMonitoringConfig();
        
        return builder()
            .schedulerConfig(new SchedulerConfig(
                string(properties, "scheduler.timezone", scheduler.getTimezone()),
                seconds(properties, "scheduler.idle-poll-seconds", scheduler.getIdlePollInterval())))
            .executorConfig(new ExecutorConfig(
                integer(properties, "executor.core-pool-size", executor.getCorePoolSize()),
                integer(properties, "executor.max-pool-size", executor.getMaximumPoolSize()),
                seconds(properties, "executor.keep-alive-seconds", executor.getKeepAliveTime()),
                integer(properties, "executor.queue-capacity", executor.getQueueCapacity()),
                seconds(properties, "executor.shutdown-timeout-seconds", executor.getShutdownTimeout())))
            .downloadConfig(new DownloadConfig(
                string(properties, "download.root", download.getDownloadRoot()),
                seconds(properties, "download.timeout-seconds", download.getTimeout()),
                seconds(properties, "download.connect-timeout-seconds", download.getConnectTimeout()),
                string(properties, "download.user-agent", download.getUserAgent())))
            .repositoryConfig(new RepositoryConfig(
                string(properties, "repository.db-path", repository.getDbPath()),
                Boolean.parseBoolean(string(properties, "repository.in-memory", String.valueOf(repository.isInMemory())))))
            .monitoringConfig(new MonitoringConfig(
                Boolean.parseBoolean(string(properties, "monitoring.metrics-enabled", String.valueOf(monitoring.isEnableMetrics())))))
            .build();
    }
    
    private static String string(Properties properties, String key, String defaultValue) {
        String value = properties.getProperty(PREFIX + key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }
    
    private static int integer(Properties properties, String key, int defaultValue) {
        String value = string(properties, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + PREFIX + key + " is not an integer: " + value, e);
        }
    }
    
    private static Duration seconds(Properties properties, String key, Duration defaultValue) {
        String value = string(properties, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + PREFIX + key + " is not a number of seconds: " + value, e);
        }
    }
    
    /**
     * Default configurations
     */
    public static class Defaults {
        public static SchedulerConfig defaultSchedulerConfig() {
            return new SchedulerConfig("Asia/Shanghai", Duration.ofMinutes(1));
        }
        
        public static ExecutorConfig defaultExecutorConfig() {
            return new ExecutorConfig(
                2, 8, Duration.ofMinutes(1), 1000, Duration.ofSeconds(30)
            );
        }
        
        public static DownloadConfig defaultDownloadConfig() {
            return new DownloadConfig(
                "downloads", Duration.ofSeconds(30), Duration.ofSeconds(10), "auto-save-link/1.0"
            );
        }
        
        public static RepositoryConfig defaultRepositoryConfig() {
            return new RepositoryConfig("data/tasks.db", false);
        }
        
        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true);
        }
    }
}
