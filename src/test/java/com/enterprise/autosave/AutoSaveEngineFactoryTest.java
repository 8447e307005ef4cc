package com.enterprise.autosave;

import com.enterprise.autosave.config.AutoSaveConfig;
import com.enterprise.autosave.core.DownloadOutcome;
import com.enterprise.autosave.core.DownloadTask;
import com.enterprise.autosave.core.TaskFields;
import com.enterprise.autosave.core.TaskStatus;
import com.enterprise.autosave.exception.RecurrenceParseException;
import com.enterprise.autosave.exception.TaskNotFoundException;
import com.enterprise.autosave.repository.MapDBTaskRepository;
import com.enterprise.autosave.repository.TaskRepository;
import com.enterprise.autosave.scheduler.ReloadReport;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

class AutoSaveEngineFactoryTest {
    
    @TempDir
    Path tempDir;
    
    private AutoSaveEngineFactory.AutoSaveService service;
    
    @BeforeEach
    void setUp() {
        service = null;
    }
    
    @AfterEach
    void tearDown() {
        if (service != null) {
            service.stop();
        }
    }
    
    private AutoSaveConfig config(boolean inMemory) {
        return AutoSaveConfig.builder()
            .downloadConfig(new AutoSaveConfig.DownloadConfig(
                tempDir.resolve("downloads").toString(), Duration.ofSeconds(5), Duration.ofSeconds(2), "test"))
            .repositoryConfig(new AutoSaveConfig.RepositoryConfig(
                tempDir.resolve("data").resolve("tasks.db").toString(), inMemory))
            .executorConfig(new AutoSaveConfig.ExecutorConfig(
                1, 2, Duration.ofSeconds(30), 10, Duration.ofSeconds(5)))
            .build();
    }
    
    private static TaskFields fields(String url, String expression, TaskStatus status) {
        return new TaskFields("iptv", url, "iptv_{date}.m3u", expression, status);
    }
    
    @Test
    void testCreateInMemory() {
        service = AutoSaveEngineFactory.create(config(true));
        
        assertNotNull(service.getController());
        assertNotNull(service.getRegistry());
        assertNotNull(service.getRepository());
        assertNotNull(service.getMetricsCollector());
        assertNotNull(service.getHealthChecker());
        assertFalse(service.isRunning());
    }
    
    @Test
    void testCreateWithInvalidConfig() {
        AutoSaveConfig invalid = AutoSaveConfig.builder()
            .schedulerConfig(new AutoSaveConfig.SchedulerConfig("Nowhere/Never", Duration.ofMinutes(1)))
            .executorConfig(new AutoSaveConfig.ExecutorConfig(
                -1, 8, Duration.ofMinutes(1), 100, Duration.ofSeconds(30)))
            .build();
        
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> AutoSaveEngineFactory.create(invalid));
        assertTrue(e.getMessage().contains("scheduler.timezone"));
        assertTrue(e.getMessage().contains("executor.corePoolSize"));
    }
    
    @Test
    void testMetricsCanBeDisabled() {
        AutoSaveConfig config = AutoSaveConfig.builder()
            .repositoryConfig(new AutoSaveConfig.RepositoryConfig("", true))
            .monitoringConfig(new AutoSaveConfig.MonitoringConfig(false))
            .build();
        
        service = AutoSaveEngineFactory.create(config);
        
        assertNull(service.getMetricsCollector());
    }
    
    @Test
    void testStartLoadsActiveTasksFromRepository() throws Exception {
        MapDBTaskRepository repository = MapDBTaskRepository.inMemory();
        DownloadTask active = repository.create(fields("http://example.com/a.m3u", "0 2 * * *", null));
        DownloadTask inactive = repository.create(fields("http://example.com/b.m3u", "0 2 * * *", TaskStatus.INACTIVE));
        DownloadTask broken = repository.create(fields("http://example.com/c.m3u", "0 2 * *", null));
        
        service = AutoSaveEngineFactory.create(config(true), repository);
        try {
            ReloadReport report = service.start();
            
            assertTrue(service.isRunning());
            assertTrue(service.getRegistry().contains(active.getId()));
            assertFalse(service.getRegistry().contains(inactive.getId()));
            assertTrue(report.getSkipped().containsKey(broken.getId()));
            assertTrue(service.getHealthChecker().check().getChecks().get("engine.running").isPassed());
        } finally {
            service.stop();
            service = null;
            repository.close();
        }
    }
    
    @Test
    void testTaskLifecycleThroughService() throws Exception {
        service = AutoSaveEngineFactory.create(config(false));
        service.start();
        
        DownloadTask task = service.createTask(fields("http://example.com/a.m3u", "0 2 * * *", null));
        assertTrue(service.getRegistry().contains(task.getId()));
        
        service.updateTask(task.getId(), fields("http://example.com/a.m3u", "0 2 * * *", TaskStatus.INACTIVE));
        assertFalse(service.getRegistry().contains(task.getId()));
        
        service.updateTask(task.getId(), fields("http://example.com/a.m3u", "*/10 * * * *", TaskStatus.ACTIVE));
        assertTrue(service.getRegistry().contains(task.getId()));
        
        assertTrue(service.deleteTask(task.getId()));
        assertFalse(service.getRegistry().contains(task.getId()));
        assertTrue(service.getRepository().get(task.getId()).isEmpty());
    }
    
    @Test
    void testInvalidRecurrenceIsNotPersisted() {
        service = AutoSaveEngineFactory.create(config(true));
        
        assertThrows(RecurrenceParseException.class,
            () -> service.createTask(fields("http://example.com/a.m3u", "61 * * * *", null)));
        assertTrue(service.getRepository().list().isEmpty());
        
        assertThrows(TaskNotFoundException.class,
            () -> service.updateTask(5, fields("http://example.com/a.m3u", "0 2 * * *", null)));
    }
    
    @Test
    void testRunNowDownloadsAndRecordsLastRun() throws Exception {
        MockWebServer server = new MockWebServer();
        server.start();
        try {
            server.enqueue(new MockResponse().setBody("#EXTM3U"));
            service = AutoSaveEngineFactory.create(config(true));
            DownloadTask task = service.createTask(fields(server.url("/list.m3u").toString(), "0 2 * * *", null));
            
            DownloadOutcome outcome = service.runNow(task.getId()).get(10, TimeUnit.SECONDS);
            
            assertTrue(outcome.isSuccess());
            assertEquals("#EXTM3U", Files.readString(outcome.getOutputPath()));
            assertTrue(outcome.getOutputPath().startsWith(tempDir.resolve("downloads").toAbsolutePath()));
            assertNotNull(service.getRepository().get(task.getId()).orElseThrow().getLastRunAt());
            assertThrows(TaskNotFoundException.class, () -> service.runNow(12345));
        } finally {
            server.shutdown();
        }
    }
    
    @Test
    void testDeleteDuringUpdateLeavesNoJobBehind() throws Exception {
        MapDBTaskRepository store = MapDBTaskRepository.inMemory();
        PausingTaskRepository repository = new PausingTaskRepository(store);
        service = AutoSaveEngineFactory.create(config(true), repository);
        try {
            DownloadTask task = service.createTask(fields("http://example.com/a.m3u", "0 2 * * *", null));
            repository.pauseNextUpdate();
            
            CompletableFuture<DownloadTask> update = CompletableFuture.supplyAsync(() -> {
                try {
                    return service.updateTask(task.getId(), fields("http://example.com/a.m3u", "*/10 * * * *", null));
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });
            assertTrue(repository.updateWritten.await(5, TimeUnit.SECONDS));
            
            CompletableFuture<Boolean> deletion = CompletableFuture.supplyAsync(() -> service.deleteTask(task.getId()));
            Thread.sleep(200);
            assertFalse(deletion.isDone(), "delete must wait for the pending update");
            
            repository.releaseUpdate.countDown();
            update.get(5, TimeUnit.SECONDS);
            assertTrue(deletion.get(5, TimeUnit.SECONDS));
            
            assertTrue(service.getRepository().get(task.getId()).isEmpty());
            assertFalse(service.getRegistry().contains(task.getId()));
        } finally {
            service.stop();
            service = null;
            store.close();
        }
    }
    
    /**
     * Repository whose next update blocks after its write until released
     */
    private static class PausingTaskRepository implements TaskRepository {
        private final TaskRepository delegate;
        private final CountDownLatch updateWritten = new CountDownLatch(1);
        private final CountDownLatch releaseUpdate = new CountDownLatch(1);
        private volatile boolean pauseUpdate;
        
        PausingTaskRepository(TaskRepository delegate) {
            this.delegate = delegate;
        }
        
        void pauseNextUpdate() {
            pauseUpdate = true;
        }
        
        @Override
        public Optional<DownloadTask> get(long id) { return delegate.get(id); }
        
        @Override
        public List<DownloadTask> list() { return delegate.list(); }
        
        @Override
        public List<DownloadTask> listActive() { return delegate.listActive(); }
        
        @Override
        public DownloadTask create(TaskFields fields) { return delegate.create(fields); }
        
        @Override
        public DownloadTask update(long id, TaskFields fields) throws TaskNotFoundException {
            DownloadTask updated = delegate.update(id, fields);
            if (pauseUpdate) {
                pauseUpdate = false;
                updateWritten.countDown();
                try {
                    releaseUpdate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return updated;
        }
        
        @Override
        public boolean delete(long id) { return delegate.delete(id); }
        
        @Override
        public void setLastRun(long id, Instant lastRunAt) throws TaskNotFoundException {
            delegate.setLastRun(id, lastRunAt);
        }
    }
}
