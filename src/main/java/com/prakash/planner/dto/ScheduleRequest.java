package com.prakash.planner.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleRequest {

    @NotNull(message = "Tasks array is required.")
    private List<@NotNull @Valid TaskDto> tasks;

    @Valid
    private PreferencesDto preferences;

    // Ask the estimation agent to fill in missing durations and priorities before planning
    private boolean estimateMissing;
}
