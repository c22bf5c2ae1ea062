package com.prakash.planner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A pending task handed to the planner. Read-only for the duration of a planning call.
 */
@Value
@Builder(toBuilder = true)
public class PlanningTask {

    public static final int DEFAULT_DURATION_MINUTES = 60;

    String id;
    String title;
    Integer estimatedDuration; // minutes, may be null
    TaskPriority priority;     // may be null, treated as MEDIUM
    Instant dueDate;
    String type;               // passed through, not used for planning

    /**
     * Duration the planner actually reserves: the estimate when positive, otherwise one hour.
     */
    public int effectiveDurationMinutes() {
        return estimatedDuration != null && estimatedDuration > 0 ? estimatedDuration : DEFAULT_DURATION_MINUTES;
    }

    public TaskPriority effectivePriority() {
        return priority != null ? priority : TaskPriority.MEDIUM;
    }

    public boolean hasDueDate() {
        return dueDate != null;
    }
}
