package com.prakash.planner.dto;

import com.prakash.planner.model.PlanningTask;
import com.prakash.planner.model.TaskPriority;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskDto {

    private String id;

    @NotBlank(message = "Task title cannot be blank.")
    private String title;

    private Integer estimatedDuration; // minutes
    private TaskPriority priority;
    private Instant dueDate;
    private String type;

    public PlanningTask toModel() {
        return PlanningTask.builder()
                .id(id)
                .title(title)
                .estimatedDuration(estimatedDuration)
                .priority(priority)
                .dueDate(dueDate)
                .type(type)
                .build();
    }

    // Factory method to echo a planned task back to the caller
    public static TaskDto fromModel(PlanningTask task) {
        if (task == null) {
            return null;
        }
        return TaskDto.builder()
                .id(task.getId())
                .title(task.getTitle())
                .estimatedDuration(task.getEstimatedDuration())
                .priority(task.getPriority())
                .dueDate(task.getDueDate())
                .type(task.getType())
                .build();
    }
}
