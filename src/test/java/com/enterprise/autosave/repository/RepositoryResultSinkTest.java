package com.enterprise.autosave.repository;

import com.enterprise.autosave.core.DownloadOutcome;
import com.enterprise.autosave.core.DownloadTask;
import com.enterprise.autosave.core.FailureReason;
import com.enterprise.autosave.core.TaskFields;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Instant;

class RepositoryResultSinkTest {
    
    private MapDBTaskRepository repository;
    private RepositoryResultSink sink;
    private DownloadTask task;
    
    @BeforeEach
    void setUp() {
        repository = MapDBTaskRepository.inMemory();
        sink = new RepositoryResultSink(repository);
        task = repository.create(new TaskFields("iptv", "http://example.com/list.m3u",
            "iptv_{date}.m3u", "0 2 * * *", null));
    }
    
    @AfterEach
    void tearDown() {
        repository.close();
    }
    
    @Test
    void testSuccessRecordsLastRun() {
        Instant firedAt = Instant.parse("2024-05-20T18:00:00Z");
        
        sink.onResult(task.getId(), DownloadOutcome.success(Path.of("iptv_20240521.m3u"), 10, 5), firedAt);
        
        assertEquals(firedAt, repository.get(task.getId()).orElseThrow().getLastRunAt());
    }
    
    @Test
    void testFailureRecordsLastRun() {
        Instant firedAt = Instant.parse("2024-05-20T18:00:00Z");
        
        sink.onResult(task.getId(),
            DownloadOutcome.failure(Path.of("iptv_20240521.m3u"), FailureReason.httpStatus(500), 5), firedAt);
        
        assertEquals(firedAt, repository.get(task.getId()).orElseThrow().getLastRunAt());
    }
    
    @Test
    void testDeletedTaskIsIgnored() {
        repository.delete(task.getId());
        
        assertDoesNotThrow(() -> sink.onResult(task.getId(),
            DownloadOutcome.success(Path.of("x"), 1, 1), Instant.now()));
        assertTrue(repository.list().isEmpty());
    }
}
