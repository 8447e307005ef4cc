package com.enterprise.autosave.scheduler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a bulk reload: which tasks were scheduled and which were skipped, and why
 */
public class ReloadReport {
    
    private final List<Long> scheduled;
    private final Map<Long, String> skipped;
    
    public ReloadReport(List<Long> scheduled, Map<Long, String> skipped) {
        this.scheduled = List.copyOf(scheduled);
        this.skipped = Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
    }
    
    public List<Long> getScheduled() { return scheduled; }
    
    /**
     * Skipped task ids mapped to the reason they could not be scheduled
     */
    public Map<Long, String> getSkipped() { return skipped; }
    
    public int getScheduledCount() {
        return scheduled.size();
    }
    
    @Override
    public String toString() {
        return "ReloadReport{scheduled=" + scheduled.size() + ", skipped=" + skipped.keySet() + '}';
    }
}
