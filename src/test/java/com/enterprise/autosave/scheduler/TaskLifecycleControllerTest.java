package com.enterprise.autosave.scheduler;

import com.enterprise.autosave.config.AutoSaveConfig;
import com.enterprise.autosave.core.DownloadOutcome;
import com.enterprise.autosave.core.DownloadTask;
import com.enterprise.autosave.core.TaskStatus;
import com.enterprise.autosave.exception.RecurrenceParseException;
import com.enterprise.autosave.recurrence.RecurrenceParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;
import static com.enterprise.autosave.scheduler.JobRegistryTest.shanghai;
import static com.enterprise.autosave.scheduler.JobRegistryTest.task;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

class TaskLifecycleControllerTest {
    
    @TempDir
    Path downloadRoot;
    
    private MutableClock clock;
    private JobRegistry registry;
    private StubDownloadExecutor executor;
    private RecordingResultSink sink;
    private SchedulerEngine engine;
    private TaskLifecycleController controller;
    
    @BeforeEach
    void setUp() {
        clock = new MutableClock(shanghai(2024, 5, 20, 10, 0));
        registry = new JobRegistry(clock);
        executor = new StubDownloadExecutor(new CountDownLatch(0));
        sink = new RecordingResultSink();
        AutoSaveConfig config = AutoSaveConfig.builder()
            .downloadConfig(new AutoSaveConfig.DownloadConfig(
                downloadRoot.toString(), Duration.ofSeconds(5), Duration.ofSeconds(2), "test"))
            .build();
        engine = new SchedulerEngine(registry, executor, sink, config, clock, null);
        controller = new TaskLifecycleController(new RecurrenceParser(ZoneId.of("Asia/Shanghai")), engine);
    }
    
    @AfterEach
    void tearDown() throws Exception {
        engine.shutdown().get(10, TimeUnit.SECONDS);
        executor.close();
    }
    
    @Test
    void testRegisterActiveTask() throws Exception {
        controller.registerOrReplace(task(1, "0 2 * * *"));
        
        assertEquals(Optional.of(shanghai(2024, 5, 21, 2, 0)), registry.nextFireAt(1));
    }
    
    @Test
    void testReplaceUsesNewRecurrence() throws Exception {
        controller.registerOrReplace(task(1, "0 2 * * *"));
        controller.registerOrReplace(task(1, "30 11 * * *"));
        
        assertEquals(1, registry.size());
        assertEquals(Optional.of(shanghai(2024, 5, 20, 11, 30)), registry.nextFireAt(1));
    }
    
    @Test
    void testDeactivatedTaskIsUnscheduled() throws Exception {
        DownloadTask task = task(1, "0 2 * * *");
        controller.registerOrReplace(task);
        
        controller.registerOrReplace(task.toBuilder().status(TaskStatus.INACTIVE).build());
        
        assertFalse(registry.contains(1));
    }
    
    @Test
    void testInvalidRecurrenceKeepsExistingJob() throws Exception {
        controller.registerOrReplace(task(1, "0 2 * * *"));
        
        RecurrenceParseException e = assertThrows(RecurrenceParseException.class,
            () -> controller.registerOrReplace(task(1, "0 2 * *")));
        
        assertEquals(RecurrenceParseException.ErrorKind.MALFORMED_EXPRESSION, e.getKind());
        assertEquals(Optional.of(shanghai(2024, 5, 21, 2, 0)), registry.nextFireAt(1));
    }
    
    @Test
    void testUnregisterIsIdempotent() throws Exception {
        controller.registerOrReplace(task(1, "0 2 * * *"));
        
        controller.unregister(1);
        controller.unregister(1);
        
        assertEquals(0, registry.size());
    }
    
    @Test
    void testReloadSkipsMalformedAndInactiveTasks() throws Exception {
        controller.registerOrReplace(task(9, "0 2 * * *"));
        List<DownloadTask> tasks = List.of(
            task(1, "0 2 * * *"),
            task(2, "not a cron"),
            task(3, "*/15 * * * *").toBuilder().status(TaskStatus.INACTIVE).build(),
            task(4, "0 0 30 2 *"),
            task(5, "*/15 * * * *"));
        
        ReloadReport report = controller.reloadAll(tasks);
        
        assertEquals(List.of(1L, 5L), report.getScheduled());
        assertEquals(2, report.getScheduledCount());
        assertEquals(2, report.getSkipped().size());
        assertTrue(report.getSkipped().containsKey(2L));
        assertTrue(report.getSkipped().containsKey(4L));
        
        assertEquals(2, registry.size());
        assertTrue(registry.contains(1));
        assertTrue(registry.contains(5));
        assertFalse(registry.contains(9));
    }
    
    @Test
    void testReloadOfEmptyListClearsSchedule() throws Exception {
        controller.registerOrReplace(task(1, "0 2 * * *"));
        
        ReloadReport report = controller.reloadAll(List.of());
        
        assertEquals(0, report.getScheduledCount());
        assertEquals(0, registry.size());
    }
    
    @Test
    void testRunNowBypassesRegistry() throws Exception {
        DownloadTask task = task(3, "0 2 * * *");
        
        DownloadOutcome outcome = controller.runNow(3, task).get(5, TimeUnit.SECONDS);
        
        assertTrue(outcome.isSuccess());
        assertFalse(registry.contains(3));
        assertEquals(3, sink.await().taskId);
    }
    
    @Test
    void testRunNowRejectsMismatchedId() {
        assertThrows(IllegalArgumentException.class, () -> controller.runNow(4, task(3, "0 2 * * *")));
    }
}
