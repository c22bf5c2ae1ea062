package com.prakash.planner.model;

import com.prakash.planner.exception.InvalidScheduleRequestException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Working-time constraints for one planning call.
 * <p>
 * Every field is defaulted once in the constructor, so a partially specified builder still yields a
 * complete value. Instances are immutable; {@link #validate()} must pass before the planner uses them.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SchedulingPreferences {

    public static final LocalTime DEFAULT_WORK_START = LocalTime.of(9, 0);
    public static final LocalTime DEFAULT_WORK_END = LocalTime.of(17, 0);
    public static final int DEFAULT_BREAK_MINUTES = 15;
    public static final int DEFAULT_FOCUS_SESSION_MINUTES = 90;
    public static final ZoneId DEFAULT_TIME_ZONE = ZoneId.of("UTC");
    public static final Set<DayOfWeek> DEFAULT_WORK_DAYS = Collections.unmodifiableSet(
            EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));

    private final LocalTime workStart;
    private final LocalTime workEnd;
    private final int breakMinutes;
    private final int focusSessionMinutes; // reserved, the planner does not split tasks into sessions
    private final ZoneId timeZone;
    private final Set<DayOfWeek> workDays;

    @Builder
    private SchedulingPreferences(LocalTime workStart,
                                  LocalTime workEnd,
                                  Integer breakMinutes,
                                  Integer focusSessionMinutes,
                                  ZoneId timeZone,
                                  Set<DayOfWeek> workDays) {
        this.workStart = workStart != null ? workStart : DEFAULT_WORK_START;
        this.workEnd = workEnd != null ? workEnd : DEFAULT_WORK_END;
        this.breakMinutes = breakMinutes != null ? breakMinutes : DEFAULT_BREAK_MINUTES;
        this.focusSessionMinutes = focusSessionMinutes != null ? focusSessionMinutes : DEFAULT_FOCUS_SESSION_MINUTES;
        this.timeZone = timeZone != null ? timeZone : DEFAULT_TIME_ZONE;
        if (workDays == null) {
            this.workDays = DEFAULT_WORK_DAYS;
        } else if (workDays.isEmpty()) {
            this.workDays = Collections.emptySet();
        } else {
            this.workDays = Collections.unmodifiableSet(EnumSet.copyOf(workDays));
        }
    }

    public static SchedulingPreferences defaults() {
        return builder().build();
    }

    public boolean isWorkDay(DayOfWeek day) {
        return workDays.contains(day);
    }

    /**
     * Checks the preconditions the planner relies on. An empty work-day set would make the
     * day-roll walk endless, so it is rejected here.
     *
     * @return this instance, for chaining
     * @throws InvalidScheduleRequestException if any constraint is violated
     */
    public SchedulingPreferences validate() {
        if (workDays.isEmpty()) {
            throw new InvalidScheduleRequestException("At least one work day must be configured.");
        }
        if (!workStart.isBefore(workEnd)) {
            throw new InvalidScheduleRequestException(
                    "Working hours start (" + workStart + ") must be before end (" + workEnd + ").");
        }
        if (breakMinutes < 0) {
            throw new InvalidScheduleRequestException("Break duration cannot be negative: " + breakMinutes);
        }
        if (focusSessionMinutes <= 0) {
            throw new InvalidScheduleRequestException("Focus session length must be positive: " + focusSessionMinutes);
        }
        return this;
    }
}
