package com.enterprise.autosave.core;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Renders output filenames. The only placeholder is {@code {date}}, replaced by the
 * local date as {@code yyyyMMdd}.
 */
public final class FilenameTemplate {
    
    public static final String DATE_PLACEHOLDER = "{date}";
    
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    
    private FilenameTemplate() {
    }
    
    public static String render(String template, LocalDate date) {
        return template.replace(DATE_PLACEHOLDER, DATE_FORMAT.format(date));
    }
    
    /**
     * Render the template and resolve it under {@code root}.
     *
     * @throws IllegalArgumentException if the rendered name escapes the root directory
     */
    public static Path resolve(Path root, String template, LocalDate date) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path resolved = normalizedRoot.resolve(render(template, date)).normalize();
        if (!resolved.startsWith(normalizedRoot) || resolved.equals(normalizedRoot)) {
            throw new IllegalArgumentException("Filename template resolves outside download root: " + template);
        }
        return resolved;
    }
}
