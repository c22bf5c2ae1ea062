package com.prakash.planner.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

// Partial preferences as sent by clients; every field is optional
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PreferencesDto {

    private WorkingHours workingHours;
    private Integer breakDuration;      // minutes
    private Integer focusSessionLength; // minutes, accepted but not enforced
    private String timezone;
    private List<Integer> workDays;     // 1 = Monday ... 7 = Sunday

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WorkingHours {
        private String start; // "09:00"
        private String end;   // "17:00"
    }
}
