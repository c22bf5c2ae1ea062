package com.prakash.planner.service;

import com.prakash.planner.model.SchedulingPreferences;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Working-time arithmetic over validated preferences, evaluated in the preference time zone.
 * Holds no mutable state; the planner owns the cursor.
 */
class WorkingCalendar {

    static final int SLOT_GRANULARITY_MINUTES = 15;

    private final SchedulingPreferences preferences;

    WorkingCalendar(SchedulingPreferences preferences) {
        this.preferences = preferences;
    }

    /**
     * First cursor position: {@code now} rounded up to the next quarter hour, moved to a working
     * start if that falls outside working hours or on a non-work day.
     */
    ZonedDateTime initialCursor(Instant now) {
        ZonedDateTime cursor = now.atZone(preferences.getTimeZone()).truncatedTo(ChronoUnit.MINUTES);
        int remainder = cursor.getMinute() % SLOT_GRANULARITY_MINUTES;
        if (remainder != 0) {
            cursor = cursor.plusMinutes(SLOT_GRANULARITY_MINUTES - remainder);
        }
        return isWithinWorkingHours(cursor) ? cursor : nextWorkingStart(cursor);
    }

    boolean isWithinWorkingHours(ZonedDateTime time) {
        LocalTime timeOfDay = time.toLocalTime();
        return preferences.isWorkDay(time.getDayOfWeek())
                && !timeOfDay.isBefore(preferences.getWorkStart())
                && timeOfDay.isBefore(preferences.getWorkEnd());
    }

    /**
     * Whether a block of {@code minutes} can start at {@code start} and finish strictly before the
     * working end of the same day.
     */
    boolean fits(ZonedDateTime start, int minutes) {
        return isWithinWorkingHours(start) && start.plusMinutes(minutes).isBefore(workingEndOf(start));
    }

    /**
     * Earliest working start after {@code time}: the same day's start when {@code time} is on a
     * work day before hours, otherwise the start of the next permitted work day.
     */
    ZonedDateTime nextWorkingStart(ZonedDateTime time) {
        LocalDate day = time.toLocalDate();
        boolean sameDay = preferences.isWorkDay(day.getDayOfWeek())
                && time.toLocalTime().isBefore(preferences.getWorkStart());
        if (!sameDay) {
            // Terminates within a week: work days are validated non-empty
            do {
                day = day.plusDays(1);
            } while (!preferences.isWorkDay(day.getDayOfWeek()));
        }
        return ZonedDateTime.of(day, preferences.getWorkStart(), preferences.getTimeZone());
    }

    private ZonedDateTime workingEndOf(ZonedDateTime time) {
        return ZonedDateTime.of(time.toLocalDate(), preferences.getWorkEnd(), preferences.getTimeZone());
    }
}
