package com.timeslice.scheduler;

import java.util.Locale;

/**
 * Lifecycle state of a {@link Task}.
 * 
 * Transitions are one-directional: PENDING → RUNNING → COMPLETED.
 * CANCELLED is reserved and never assigned by the scheduler.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    CANCELLED;
    
    /**
     * @return lower-case name used in snapshots (e.g. "pending")
     */
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    /**
     * Parses a label or enum name, case-insensitive.
     * 
     * @param value "pending", "RUNNING", ...
     * @return matching status
     * @throws IllegalArgumentException if value is not a known status
     */
    public static TaskStatus fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
