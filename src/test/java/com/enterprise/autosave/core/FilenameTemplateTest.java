package com.enterprise.autosave.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.LocalDate;

class FilenameTemplateTest {
    
    @TempDir
    Path root;
    
    @Test
    void testRenderDate() {
        assertEquals("1_20240520.m3u", FilenameTemplate.render("1_{date}.m3u", LocalDate.of(2024, 5, 20)));
    }
    
    @Test
    void testRenderEveryOccurrence() {
        assertEquals("20240105/list_20240105.txt",
            FilenameTemplate.render("{date}/list_{date}.txt", LocalDate.of(2024, 1, 5)));
    }
    
    @Test
    void testTemplateWithoutPlaceholderIsUnchanged() {
        assertEquals("fixed.m3u", FilenameTemplate.render("fixed.m3u", LocalDate.of(2024, 5, 20)));
    }
    
    @Test
    void testResolveUnderRoot() {
        Path resolved = FilenameTemplate.resolve(root, "sub/1_{date}.m3u", LocalDate.of(2024, 5, 20));
        
        assertEquals(root.toAbsolutePath().normalize().resolve("sub").resolve("1_20240520.m3u"), resolved);
    }
    
    @Test
    void testResolveRejectsEscape() {
        assertThrows(IllegalArgumentException.class,
            () -> FilenameTemplate.resolve(root, "../outside_{date}.m3u", LocalDate.of(2024, 5, 20)));
        assertThrows(IllegalArgumentException.class,
            () -> FilenameTemplate.resolve(root, ".", LocalDate.of(2024, 5, 20)));
    }
}
