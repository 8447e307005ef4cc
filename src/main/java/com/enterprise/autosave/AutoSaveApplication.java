package com.enterprise.autosave;

import com.enterprise.autosave.config.AutoSaveConfig;
import com.enterprise.autosave.scheduler.ReloadReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Runs the download scheduler as a standalone process until the JVM is asked to exit.
 *
 * <p>Configuration comes from {@code autosave.*} system properties. The {@code TZ},
 * {@code DOWNLOAD_DIR} and {@code DATA_DIR} environment variables override the timezone,
 * the download root and the directory of the task database.
 */
public class AutoSaveApplication {
    
    private static final Logger logger = LoggerFactory.getLogger(AutoSaveApplication.class);
    
    public static void main(String[] args) throws InterruptedException {
        AutoSaveConfig config = AutoSaveConfig.fromProperties(
            resolveProperties(System.getenv(), System.getProperties()));
        
        AutoSaveEngineFactory.AutoSaveService service = AutoSaveEngineFactory.create(config);
        CountDownLatch stopped = new CountDownLatch(1);
        
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown requested");
            try {
                service.stop();
            } finally {
                stopped.countDown();
            }
        }, "autosave-shutdown"));
        
        ReloadReport report = service.start();
        logger.info("Auto-save scheduler started: {} tasks scheduled, {} skipped",
                   report.getScheduledCount(), report.getSkipped().size());
        
        stopped.await();
    }
    
    /**
     * Merge system properties with the environment overrides
     */
    static Properties resolveProperties(Map<String, String> env, Properties systemProperties) {
        Properties properties = new Properties();
        systemProperties.stringPropertyNames().stream()
            .filter(name -> name.startsWith(AutoSaveConfig.PREFIX))
            .forEach(name -> properties.setProperty(name, systemProperties.getProperty(name)));
        
        override(properties, "scheduler.timezone", env.get("TZ"));
        override(properties, "download.root", env.get("DOWNLOAD_DIR"));
        String dataDir = env.get("DATA_DIR");
        if (dataDir != null && !dataDir.isBlank()) {
            override(properties, "repository.db-path", Path.of(dataDir.trim(), "tasks.db").toString());
        }
        return properties;
    }
    
    private static void override(Properties properties, String key, String value) {
        if (value != null && !value.isBlank()) {
            properties.setProperty(AutoSaveConfig.PREFIX + key, value.trim());
        }
    }
}
