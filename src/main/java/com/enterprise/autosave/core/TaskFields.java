package com.enterprise.autosave.core;

import java.util.Objects;

/**
 * The user-editable fields of a download task, as submitted by the admin interface
 * for creation or update. Identity and run bookkeeping are owned by the repository.
 */
public class TaskFields {
    
    private final String name;
    private final String targetUrl;
    private final String filenameTemplate;
    private final String recurrenceExpression;
    private final TaskStatus status;
    
    public TaskFields(String name, String targetUrl, String filenameTemplate,
                      String recurrenceExpression, TaskStatus status) {
        this.name = name;
        this.targetUrl = targetUrl;
        this.filenameTemplate = filenameTemplate;
        this.recurrenceExpression = recurrenceExpression;
        this.status = status != null ? status : TaskStatus.ACTIVE;
    }
    
    public String getName() { return name; }
    public String getTargetUrl() { return targetUrl; }
    public String getFilenameTemplate() { return filenameTemplate; }
    public String getRecurrenceExpression() { return recurrenceExpression; }
    public TaskStatus getStatus() { return status; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskFields that = (TaskFields) o;
        return Objects.equals(name, that.name)
            && Objects.equals(targetUrl, that.targetUrl)
            && Objects.equals(filenameTemplate, that.filenameTemplate)
            && Objects.equals(recurrenceExpression, that.recurrenceExpression)
            && status == that.status;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, targetUrl, filenameTemplate, recurrenceExpression, status);
    }
}
