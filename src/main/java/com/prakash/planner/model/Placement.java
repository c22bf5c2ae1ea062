package com.prakash.planner.model;

import lombok.Value;

import java.time.Instant;

// One committed slot of a generated schedule
@Value
public class Placement {
    PlanningTask task;
    Instant scheduledStart;
    Instant scheduledEnd;
    double confidence;
}
