package com.prakash.planner.service;

import com.prakash.planner.config.PlannerProperties;
import com.prakash.planner.dto.PreferencesDto;
import com.prakash.planner.exception.InvalidScheduleRequestException;
import com.prakash.planner.model.SchedulingPreferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Merges the partial preferences of a request over the configured defaults and produces a
 * validated, immutable {@link SchedulingPreferences}.
 */
@Component
public class PreferencesResolver {

    private static final Logger log = LoggerFactory.getLogger(PreferencesResolver.class);

    /** {@code HH:mm}, also accepting a single-digit hour such as {@code 9:00}. */
    private static final DateTimeFormatter WORKING_TIME = DateTimeFormatter.ofPattern("H:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    private final PlannerProperties properties;

    @Autowired
    public PreferencesResolver(PlannerProperties properties) {
        this.properties = properties;
        checkDefaults();
    }

    /**
     * Fails startup when the configured defaults cannot form valid preferences on their own, so a
     * misconfiguration is not reported to clients as a bad request.
     */
    private void checkDefaults() {
        try {
            resolve(null);
        } catch (InvalidScheduleRequestException e) {
            throw new IllegalStateException("Invalid planner.defaults configuration: " + e.getMessage(), e);
        }
    }

    public SchedulingPreferences resolve(PreferencesDto requested) {
        PreferencesDto prefs = requested != null ? requested : new PreferencesDto();
        PreferencesDto.WorkingHours hours = prefs.getWorkingHours();

        String start = hours != null && hours.getStart() != null ? hours.getStart() : properties.getWorkStart();
        String end = hours != null && hours.getEnd() != null ? hours.getEnd() : properties.getWorkEnd();

        SchedulingPreferences resolved = SchedulingPreferences.builder()
                .workStart(parseTime(start, "start"))
                .workEnd(parseTime(end, "end"))
                .breakMinutes(prefs.getBreakDuration() != null ? prefs.getBreakDuration() : properties.getBreakDuration())
                .focusSessionMinutes(prefs.getFocusSessionLength() != null ? prefs.getFocusSessionLength() : properties.getFocusSessionLength())
                .timeZone(parseZone(prefs.getTimezone() != null ? prefs.getTimezone() : properties.getTimezone()))
                .workDays(toWorkDays(prefs.getWorkDays() != null ? prefs.getWorkDays() : properties.getWorkDays()))
                .build()
                .validate();
        log.debug("Resolved scheduling preferences: {}", resolved);
        return resolved;
    }

    private LocalTime parseTime(String value, String label) {
        try {
            return LocalTime.parse(value.trim(), WORKING_TIME);
        } catch (DateTimeParseException e) {
            throw new InvalidScheduleRequestException("Invalid working hours " + label + " '" + value + "', expected HH:mm.", e);
        }
    }

    private ZoneId parseZone(String value) {
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            throw new InvalidScheduleRequestException("Unknown timezone '" + value + "'.", e);
        }
    }

    /**
     * Maps weekday numbers (1 = Monday ... 7 = Sunday, 0 also meaning Sunday) to days.
     */
    static Set<DayOfWeek> toWorkDays(List<Integer> numbers) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (Integer number : numbers) {
            if (number == null || number < 0 || number > 7) {
                throw new InvalidScheduleRequestException("Invalid work day '" + number + "', expected 1 (Monday) to 7 (Sunday).");
            }
            days.add(number == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(number));
        }
        return days;
    }
}
