package com.prakash.planner.service;

import com.prakash.planner.dto.ScheduleMetadata;
import com.prakash.planner.dto.ScheduleRequest;
import com.prakash.planner.dto.ScheduleResponse;
import com.prakash.planner.dto.ScheduledTaskInfo;
import com.prakash.planner.dto.TaskDto;
import com.prakash.planner.exception.InvalidScheduleRequestException;
import com.prakash.planner.model.PlanningTask;
import com.prakash.planner.model.Placement;
import com.prakash.planner.model.SchedulingPreferences;
import com.prakash.planner.service.agent.TaskEstimationAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class SchedulingService {

    private static final Logger log = LoggerFactory.getLogger(SchedulingService.class);

    public static final String SCHEDULING_ALGORITHM = "priority_and_duration_based";

    private final SchedulePlanner schedulePlanner;
    private final PreferencesResolver preferencesResolver;
    private final TaskEstimationAgent taskEstimationAgent;
    private final Clock clock;

    @Autowired
    public SchedulingService(SchedulePlanner schedulePlanner,
                             PreferencesResolver preferencesResolver,
                             TaskEstimationAgent taskEstimationAgent,
                             Clock clock) {
        this.schedulePlanner = schedulePlanner;
        this.preferencesResolver = preferencesResolver;
        this.taskEstimationAgent = taskEstimationAgent;
        this.clock = clock;
    }

    /**
     * Generates a schedule for the requested tasks starting from the current time.
     *
     * @param request tasks, optional partial preferences and the estimation flag
     * @return the placements in committed order plus summary metadata
     * @throws InvalidScheduleRequestException if tasks or preferences are invalid
     */
    public ScheduleResponse generateSchedule(ScheduleRequest request) {
        if (request == null || request.getTasks() == null) {
            throw new InvalidScheduleRequestException("Tasks array is required.");
        }
        Instant now = clock.instant();
        log.info("Generating schedule for {} tasks (reference time {}, estimateMissing={})",
                request.getTasks().size(), now, request.isEstimateMissing());

        SchedulingPreferences preferences = preferencesResolver.resolve(request.getPreferences());

        List<PlanningTask> tasks = request.getTasks().stream()
                .map(dto -> {
                    if (dto == null) {
                        throw new InvalidScheduleRequestException("Tasks array must not contain null entries.");
                    }
                    return dto.toModel();
                })
                .collect(Collectors.toList());

        if (request.isEstimateMissing()) {
            tasks = estimateMissingFields(tasks);
        }

        List<Placement> placements = schedulePlanner.plan(tasks, preferences, now);

        ScheduleMetadata metadata = summarize(tasks, placements, now);
        log.info("Schedule generated: {} placements, {} minutes total, average confidence {}",
                placements.size(), metadata.getTotalDuration(), metadata.getAverageConfidence());

        List<ScheduledTaskInfo> schedule = placements.stream()
                .map(ScheduledTaskInfo::fromPlacement)
                .collect(Collectors.toList());
        return new ScheduleResponse(schedule, metadata);
    }

    private List<PlanningTask> estimateMissingFields(List<PlanningTask> tasks) {
        long missing = tasks.stream().filter(TaskEstimationAgent::needsEstimate).count();
        if (missing == 0) {
            log.debug("All tasks already carry a duration and priority; skipping estimation.");
            return tasks;
        }
        log.info("Requesting AI estimates for {} of {} tasks.", missing, tasks.size());
        return tasks.stream()
                .map(taskEstimationAgent::estimate)
                .collect(Collectors.toList());
    }

    /**
     * Summary over a generated schedule. Average confidence of an empty schedule is 0.
     */
    static ScheduleMetadata summarize(List<PlanningTask> tasks, List<Placement> placements, Instant generatedAt) {
        long totalDuration = tasks.stream().mapToLong(PlanningTask::effectiveDurationMinutes).sum();
        double averageConfidence = placements.stream()
                .mapToDouble(Placement::getConfidence)
                .average()
                .orElse(0.0);
        return ScheduleMetadata.builder()
                .totalTasks(tasks.size())
                .totalDuration(totalDuration)
                .averageConfidence(averageConfidence)
                .schedulingAlgorithm(SCHEDULING_ALGORITHM)
                .generatedAt(generatedAt)
                .build();
    }
}
