package com.enterprise.autosave.core;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;

class DownloadTaskTest {
    
    private DownloadTask.Builder validTask() {
        return DownloadTask.builder()
            .id(7)
            .name("iptv")
            .targetUrl("http://example.com/list.m3u")
            .filenameTemplate("7_{date}.m3u")
            .recurrenceExpression(" 0 2 * * * ");
    }
    
    @Test
    void testBuildDefaults() {
        DownloadTask task = validTask().build();
        
        assertEquals(7, task.getId());
        assertEquals(TaskStatus.ACTIVE, task.getStatus());
        assertTrue(task.isActive());
        assertEquals("0 2 * * *", task.getRecurrenceExpression());
        assertNotNull(task.getCreatedAt());
        assertNull(task.getLastRunAt());
    }
    
    @Test
    void testBuildRejectsMissingFields() {
        assertThrows(IllegalArgumentException.class, () -> validTask().name(" ").build());
        assertThrows(IllegalArgumentException.class, () -> validTask().filenameTemplate(null).build());
        assertThrows(IllegalArgumentException.class, () -> validTask().recurrenceExpression("").build());
        assertThrows(IllegalArgumentException.class, () -> validTask().status(null).build());
    }
    
    @Test
    void testBuildRejectsInvalidUrls() {
        assertThrows(IllegalArgumentException.class, () -> validTask().targetUrl(null).build());
        assertThrows(IllegalArgumentException.class, () -> validTask().targetUrl("example.com/list").build());
        assertThrows(IllegalArgumentException.class, () -> validTask().targetUrl("ftp://example.com/list").build());
        assertThrows(IllegalArgumentException.class, () -> validTask().targetUrl("http://exa mple.com").build());
        
        assertDoesNotThrow(() -> validTask().targetUrl("HTTPS://example.com:8443/a?b=c").build());
    }
    
    @Test
    void testWithFieldsKeepsIdentityAndBookkeeping() {
        Instant lastRun = Instant.parse("2024-05-20T18:00:00Z");
        DownloadTask task = validTask().lastRunAt(lastRun).build();
        
        DownloadTask updated = task.withFields(new TaskFields("renamed", "https://example.org/x",
            "x_{date}", "*/5 * * * *", TaskStatus.INACTIVE));
        
        assertEquals(task.getId(), updated.getId());
        assertEquals(task.getCreatedAt(), updated.getCreatedAt());
        assertEquals(lastRun, updated.getLastRunAt());
        assertEquals("renamed", updated.getName());
        assertFalse(updated.isActive());
    }
    
    @Test
    void testWithLastRunAt() {
        DownloadTask task = validTask().build();
        Instant firedAt = Instant.parse("2024-05-20T18:00:00Z");
        
        DownloadTask updated = task.withLastRunAt(firedAt);
        
        assertEquals(firedAt, updated.getLastRunAt());
        assertNull(task.getLastRunAt());
        assertEquals(task, updated.withLastRunAt(null));
    }
    
    @Test
    void testTaskFieldsDefaultToActive() {
        TaskFields fields = new TaskFields("n", "http://example.com", "f", "* * * * *", null);
        
        assertEquals(TaskStatus.ACTIVE, fields.getStatus());
    }
}
