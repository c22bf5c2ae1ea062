package com.prakash.planner.dto;

import com.prakash.planner.model.Placement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

// Represents one placement of the generated schedule
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledTaskInfo {
    private TaskDto task;
    private Instant scheduledStart;
    private Instant scheduledEnd;
    private double confidence;

    public static ScheduledTaskInfo fromPlacement(Placement placement) {
        return new ScheduledTaskInfo(
                TaskDto.fromModel(placement.getTask()),
                placement.getScheduledStart(),
                placement.getScheduledEnd(),
                placement.getConfidence());
    }
}
