package com.prakash.planner.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleMetadata {
    private int totalTasks;
    private long totalDuration; // minutes, 60 counted for tasks without a usable estimate
    private double averageConfidence;
    private String schedulingAlgorithm;
    private Instant generatedAt;
}
