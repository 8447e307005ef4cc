package com.enterprise.autosave.config;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

class ConfigValidatorTest {
    
    private final ConfigValidator validator = new ConfigValidator();
    
    @Test
    void testDefaultsAreValid() {
        assertTrue(validator.validate(AutoSaveConfig.builder().build()).isEmpty());
    }
    
    @Test
    void testUnknownTimezone() {
        AutoSaveConfig config = AutoSaveConfig.builder()
            .schedulerConfig(new AutoSaveConfig.SchedulerConfig("Mars/Olympus", Duration.ofMinutes(1)))
            .build();
        
        assertEquals(List.of("scheduler.timezone"), fields(config));
    }
    
    @Test
    void testExecutorLimits() {
        AutoSaveConfig config = AutoSaveConfig.builder()
            .executorConfig(new AutoSaveConfig.ExecutorConfig(
                4, 2, Duration.ofSeconds(-1), 0, Duration.ofSeconds(30)))
            .build();
        
        List<String> fields = fields(config);
        
        assertTrue(fields.contains("executor.poolSize"));
        assertTrue(fields.contains("executor.keepAliveTime"));
        assertTrue(fields.contains("executor.queueCapacity"));
        assertEquals(3, fields.size());
    }
    
    @Test
    void testDownloadSettings() {
        AutoSaveConfig config = AutoSaveConfig.builder()
            .downloadConfig(new AutoSaveConfig.DownloadConfig(" ", Duration.ZERO, null, ""))
            .build();
        
        assertEquals(List.of("download.root", "download.timeout", "download.connectTimeout", "download.userAgent"),
                     fields(config));
    }
    
    @Test
    void testDatabasePathOptionalInMemory() {
        AutoSaveConfig onDisk = AutoSaveConfig.builder()
            .repositoryConfig(new AutoSaveConfig.RepositoryConfig("", false))
            .build();
        AutoSaveConfig inMemory = AutoSaveConfig.builder()
            .repositoryConfig(new AutoSaveConfig.RepositoryConfig("", true))
            .build();
        
        assertEquals(List.of("repository.dbPath"), fields(onDisk));
        assertTrue(validator.validate(inMemory).isEmpty());
    }
    
    private List<String> fields(AutoSaveConfig config) {
        return validator.validate(config).stream()
            .map(ConfigValidator.ValidationError::getField)
            .collect(Collectors.toList());
    }
}
