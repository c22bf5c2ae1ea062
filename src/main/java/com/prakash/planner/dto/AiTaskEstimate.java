package com.prakash.planner.dto;

import com.prakash.planner.model.TaskPriority;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor // Necessary for BeanOutputConverter
public class AiTaskEstimate {

    // Property names must match the JSON fields requested in the estimation prompt
    private TaskPriority priority;
    private Integer estimatedDurationMinutes;
}
