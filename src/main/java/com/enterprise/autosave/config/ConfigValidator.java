package com.enterprise.autosave.config;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates download scheduler configuration
 */
public class ConfigValidator {
    
    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(AutoSaveConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        
        validateSchedulerConfig(config.getSchedulerConfig(), errors);
        validateExecutorConfig(config.getExecutorConfig(), errors);
        validateDownloadConfig(config.getDownloadConfig(), errors);
        validateRepositoryConfig(config.getRepositoryConfig(), errors);
        
        return errors;
    }
    
    private void validateSchedulerConfig(AutoSaveConfig.SchedulerConfig config, List<ValidationError> errors) {
        if (config.getTimezone() == null || config.getTimezone().isBlank()) {
            errors.add(new ValidationError("scheduler.timezone", 
                "Timezone is required"));
        } else {
            try {
                ZoneId.of(config.getTimezone());
            } catch (DateTimeException e) {
                errors.add(new ValidationError("scheduler.timezone", 
                    "Unknown timezone: " + config.getTimezone()));
            }
        }
        
        if (!isPositive(config.getIdlePollInterval())) {
            errors.add(new ValidationError("scheduler.idlePollInterval", 
                "Idle poll interval must be greater than 0"));
        }
    }
    
    private void validateExecutorConfig(AutoSaveConfig.ExecutorConfig config, List<ValidationError> errors) {
        if (config.getCorePoolSize() <= 0) {
            errors.add(new ValidationError("executor.corePoolSize", 
                "Core pool size must be greater than 0"));
        }
        
        if (config.getMaximumPoolSize() <= 0) {
            errors.add(new ValidationError("executor.maximumPoolSize", 
                "Maximum pool size must be greater than 0"));
        }
        
        if (config.getCorePoolSize() > config.getMaximumPoolSize()) {
            errors.add(new ValidationError("executor.poolSize", 
                "Core pool size cannot be greater than maximum pool size"));
        }
        
        if (config.getKeepAliveTime() == null || config.getKeepAliveTime().isNegative()) {
            errors.add(new ValidationError("executor.keepAliveTime", 
                "Keep alive time cannot be negative"));
        }
        
        if (config.getQueueCapacity() <= 0) {
            errors.add(new ValidationError("executor.queueCapacity", 
                "Queue capacity must be greater than 0"));
        }
        
        if (config.getShutdownTimeout() == null || config.getShutdownTimeout().isNegative()) {
            errors.add(new ValidationError("executor.shutdownTimeout", 
                "Shutdown timeout cannot be negative"));
        }
    }
    
    private void validateDownloadConfig(AutoSaveConfig.DownloadConfig config, List<ValidationError> errors) {
        if (config.getDownloadRoot() == null || config.getDownloadRoot().trim().isEmpty()) {
            errors.add(new ValidationError("download.root", 
                "Download root directory is required"));
        }
        
        if (!isPositive(config.getTimeout())) {
            errors.add(new ValidationError("download.timeout", 
                "Download timeout must be greater than 0"));
        }
        
        if (!isPositive(config.getConnectTimeout())) {
            errors.add(new ValidationError("download.connectTimeout", 
                "Connect timeout must be greater than 0"));
        }
        
        if (config.getUserAgent() == null || config.getUserAgent().isBlank()) {
            errors.add(new ValidationError("download.userAgent", 
                "User agent is required"));
        }
    }
    
    private void validateRepositoryConfig(AutoSaveConfig.RepositoryConfig config, List<ValidationError> errors) {
        if (!config.isInMemory() && (config.getDbPath() == null || config.getDbPath().trim().isEmpty())) {
            errors.add(new ValidationError("repository.dbPath", 
                "Database path is required"));
        }
    }
    
    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
    
    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        
        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }
        
        public String getField() { return field; }
        public String getMessage() { return message; }
        
        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
