package com.prakash.planner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskPriority {
    URGENT(4),
    HIGH(3),
    MEDIUM(2), // Default when a task carries no priority
    LOW(1);

    private final int rank;

    TaskPriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup used for JSON input ("urgent", "HIGH", ...).
     *
     * @throws IllegalArgumentException if the value names no priority
     */
    @JsonCreator
    public static TaskPriority fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (TaskPriority priority : values()) {
            if (priority.name().equalsIgnoreCase(value.trim())) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown task priority: " + value);
    }
}
