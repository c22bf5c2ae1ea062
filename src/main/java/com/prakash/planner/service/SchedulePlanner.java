package com.prakash.planner.service;

import com.prakash.planner.exception.InvalidScheduleRequestException;
import com.prakash.planner.exception.SchedulePlanningException;
import com.prakash.planner.model.PlanningTask;
import com.prakash.planner.model.Placement;
import com.prakash.planner.model.SchedulingPreferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic forward sweep that turns a set of pending tasks into a serial, break-separated
 * schedule inside working hours.
 * <p>
 * Stateless: the cursor lives on the stack of a single {@link #plan} call, so the bean may be used
 * concurrently. The reference time is always supplied by the caller.
 * </p>
 */
@Service
public class SchedulePlanner {

    private static final Logger log = LoggerFactory.getLogger(SchedulePlanner.class);

    public static final double BASELINE_CONFIDENCE = 0.8;
    public static final double AT_RISK_CONFIDENCE = 0.4; // due date already passed at the computed start

    /**
     * Plans every task, returning placements in the order they were committed.
     *
     * @param tasks       tasks to place, may be empty
     * @param preferences working-time constraints; {@code null} means all defaults
     * @param now         reference instant scheduling starts from
     * @return one placement per task, sorted by the planner's task order
     * @throws InvalidScheduleRequestException if the tasks or preferences are unusable
     * @throws SchedulePlanningException       if date arithmetic fails (e.g. far-future instants)
     */
    public List<Placement> plan(List<PlanningTask> tasks, SchedulingPreferences preferences, Instant now) {
        Objects.requireNonNull(now, "now");
        validateTasks(tasks);
        SchedulingPreferences prefs = (preferences != null ? preferences : SchedulingPreferences.defaults()).validate();

        if (tasks.isEmpty()) {
            log.debug("No tasks supplied; returning an empty schedule.");
            return List.of();
        }

        try {
            return sweep(TaskOrdering.sort(tasks), prefs, now);
        } catch (DateTimeException | ArithmeticException e) {
            log.error("Schedule planning failed for {} tasks from {}: {}", tasks.size(), now, e.getMessage());
            throw new SchedulePlanningException("Unable to compute schedule: " + e.getMessage(), e);
        }
    }

    private List<Placement> sweep(List<PlanningTask> orderedTasks, SchedulingPreferences prefs, Instant now) {
        WorkingCalendar calendar = new WorkingCalendar(prefs);
        ZonedDateTime cursor = calendar.initialCursor(now);
        log.debug("Planning {} tasks starting at {}", orderedTasks.size(), cursor.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));

        List<Placement> placements = new ArrayList<>(orderedTasks.size());
        for (PlanningTask task : orderedTasks) {
            int duration = task.effectiveDurationMinutes();

            // A break may have pushed the cursor past hours; only corrected when the next task is placed
            if (!calendar.fits(cursor, duration)) {
                ZonedDateTime rolled = calendar.nextWorkingStart(cursor);
                log.trace("Task '{}' ({} min) does not fit at {}; moved to {}", task.getTitle(), duration, cursor, rolled);
                cursor = rolled;
            }

            Instant start = cursor.toInstant();
            Instant end = cursor.plusMinutes(duration).toInstant();
            double confidence = task.hasDueDate() && start.isAfter(task.getDueDate())
                    ? AT_RISK_CONFIDENCE
                    : BASELINE_CONFIDENCE;

            placements.add(new Placement(task, start, end, confidence));
            log.debug("Placed '{}' at {} - {} (confidence {})", task.getTitle(), start, end, confidence);

            cursor = cursor.plusMinutes(duration).plusMinutes(prefs.getBreakMinutes());
        }
        return placements;
    }

    private void validateTasks(List<PlanningTask> tasks) {
        if (tasks == null) {
            throw new InvalidScheduleRequestException("Tasks must be supplied as a list.");
        }
        for (int i = 0; i < tasks.size(); i++) {
            PlanningTask task = tasks.get(i);
            if (task == null) {
                throw new InvalidScheduleRequestException("Task at position " + i + " is null.");
            }
            if (task.getTitle() == null || task.getTitle().isBlank()) {
                throw new InvalidScheduleRequestException("Task at position " + i + " has no title.");
            }
        }
    }
}
