package com.prakash.planner.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {
    private List<ScheduledTaskInfo> schedule;
    private ScheduleMetadata metadata;
}
