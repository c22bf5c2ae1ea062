package com.prakash.planner.controller;

import com.prakash.planner.dto.ScheduleRequest;
import com.prakash.planner.dto.ScheduleResponse;
import com.prakash.planner.exception.InvalidScheduleRequestException;
import com.prakash.planner.exception.SchedulePlanningException;
import com.prakash.planner.exception.TaskEstimationException;
import com.prakash.planner.service.SchedulingService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/schedule")
public class ScheduleController {

    private static final Logger log = LoggerFactory.getLogger(ScheduleController.class);

    private final SchedulingService schedulingService;

    @Autowired
    public ScheduleController(SchedulingService schedulingService) {
        this.schedulingService = schedulingService;
    }

    /**
     * Endpoint to generate a schedule for a list of pending tasks.
     * Expects a JSON body like: {"tasks": [{"title": "Write report", "priority": "high"}], "preferences": {...}}
     *
     * @param request tasks (required array), optional partial preferences and estimation flag
     * @return the generated placements with summary metadata
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ScheduleResponse> generateSchedule(@Valid @RequestBody ScheduleRequest request) {
        log.info("Received request to generate schedule for {} tasks", request.getTasks().size());
        try {
            ScheduleResponse response = schedulingService.generateSchedule(request);
            return ResponseEntity.ok(response);
        } catch (InvalidScheduleRequestException e) {
            // @ResponseStatus on the exception maps it to 400
            log.warn("Rejected schedule request: {}", e.getMessage());
            throw e;
        } catch (TaskEstimationException | SchedulePlanningException e) {
            log.error("Schedule generation failed: {}", e.getMessage(), e);
            throw e;
        }
    }
}
