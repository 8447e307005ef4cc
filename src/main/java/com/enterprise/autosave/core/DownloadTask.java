package com.enterprise.autosave.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable snapshot of a persisted download task. The scheduler only ever reads these;
 * the repository hands out a new snapshot after every change.
 */
public class DownloadTask {
    
    private final long id;
    private final String name;
    private final String targetUrl;
    private final String filenameTemplate;
    private final String recurrenceExpression;
    private final TaskStatus status;
    private final Instant createdAt;
    private final Instant lastRunAt;
    
    @JsonCreator
    public DownloadTask(@JsonProperty("id") long id,
                        @JsonProperty("name") String name,
                        @JsonProperty("targetUrl") String targetUrl,
                        @JsonProperty("filenameTemplate") String filenameTemplate,
                        @JsonProperty("recurrenceExpression") String recurrenceExpression,
                        @JsonProperty("status") TaskStatus status,
                        @JsonProperty("createdAt") Instant createdAt,
                        @JsonProperty("lastRunAt") Instant lastRunAt) {
        this.id = id;
        this.name = name;
        this.targetUrl = targetUrl;
        this.filenameTemplate = filenameTemplate;
        this.recurrenceExpression = recurrenceExpression;
        this.status = status;
        this.createdAt = createdAt;
        this.lastRunAt = lastRunAt;
    }
    
    public long getId() { return id; }
    public String getName() { return name; }
    public String getTargetUrl() { return targetUrl; }
    public String getFilenameTemplate() { return filenameTemplate; }
    public String getRecurrenceExpression() { return recurrenceExpression; }
    public TaskStatus getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastRunAt() { return lastRunAt; }
    
    @JsonIgnore
    public boolean isActive() {
        return status == TaskStatus.ACTIVE;
    }
    
    /**
     * Copy of this task with the user-editable fields replaced
     */
    public DownloadTask withFields(TaskFields fields) {
        return toBuilder()
            .name(fields.getName())
            .targetUrl(fields.getTargetUrl())
            .filenameTemplate(fields.getFilenameTemplate())
            .recurrenceExpression(fields.getRecurrenceExpression())
            .status(fields.getStatus())
            .build();
    }
    
    public DownloadTask withLastRunAt(Instant lastRunAt) {
        return new DownloadTask(id, name, targetUrl, filenameTemplate, recurrenceExpression,
                                status, createdAt, lastRunAt);
    }
    
    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .targetUrl(targetUrl)
            .filenameTemplate(filenameTemplate)
            .recurrenceExpression(recurrenceExpression)
            .status(status)
            .createdAt(createdAt)
            .lastRunAt(lastRunAt);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DownloadTask that = (DownloadTask) o;
        return id == that.id
            && Objects.equals(name, that.name)
            && Objects.equals(targetUrl, that.targetUrl)
            && Objects.equals(filenameTemplate, that.filenameTemplate)
            && Objects.equals(recurrenceExpression, that.recurrenceExpression)
            && status == that.status
            && Objects.equals(createdAt, that.createdAt)
            && Objects.equals(lastRunAt, that.lastRunAt);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(id, name, targetUrl, filenameTemplate, recurrenceExpression, status, createdAt, lastRunAt);
    }
    
    @Override
    public String toString() {
        return "DownloadTask{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", recurrence='" + recurrenceExpression + '\'' +
                ", status=" + status +
                '}';
    }
    
    /**
     * Builder for creating DownloadTask instances
     */
    public static class Builder {
        private long id;
        private String name;
        private String targetUrl;
        private String filenameTemplate;
        private String recurrenceExpression;
        private TaskStatus status = TaskStatus.ACTIVE;
        private Instant createdAt = Instant.now();
        private Instant lastRunAt;
        
        public Builder id(long id) {
            this.id = id;
            return this;
        }
        
        public Builder name(String name) {
            this.name = name;
            return this;
        }
        
        public Builder targetUrl(String targetUrl) {
            this.targetUrl = targetUrl;
            return this;
        }
        
        public Builder filenameTemplate(String filenameTemplate) {
            this.filenameTemplate = filenameTemplate;
            return this;
        }
        
        public Builder recurrenceExpression(String recurrenceExpression) {
            this.recurrenceExpression = recurrenceExpression;
            return this;
        }
        
        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }
        
        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }
        
        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }
        
        public DownloadTask build() {
            requireText(name, "Task name is required");
            requireText(filenameTemplate, "Filename template is required");
            requireText(recurrenceExpression, "Recurrence expression is required");
            if (status == null) {
                throw new IllegalArgumentException("Task status is required");
            }
            validateUrl(targetUrl);
            return new DownloadTask(id, name, targetUrl, filenameTemplate, recurrenceExpression.trim(),
                                    status, createdAt, lastRunAt);
        }
        
        private static void requireText(String value, String message) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(message);
            }
        }
        
        private static void validateUrl(String url) {
            requireText(url, "Target URL is required");
            try {
                URI uri = new URI(url);
                String scheme = uri.getScheme();
                if (!uri.isAbsolute() || uri.getHost() == null
                        || !("http".equals(scheme.toLowerCase(Locale.ROOT)) || "https".equals(scheme.toLowerCase(Locale.ROOT)))) {
                    throw new IllegalArgumentException("Target URL must be an absolute http(s) URL: " + url);
                }
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("Invalid target URL: " + url, e);
            }
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
}
