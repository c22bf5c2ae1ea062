package com.prakash.planner.service;

import com.prakash.planner.config.PlannerProperties;
import com.prakash.planner.dto.PreferencesDto;
import com.prakash.planner.exception.InvalidScheduleRequestException;
import com.prakash.planner.model.SchedulingPreferences;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PreferencesResolver Unit Tests")
class PreferencesResolverTest {

    private PlannerProperties properties;
    private PreferencesResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new PlannerProperties();
        resolver = new PreferencesResolver(properties);
    }

    @Test
    @DisplayName("Missing preferences resolve to the documented defaults")
    void testResolve_Defaults() {
        SchedulingPreferences resolved = resolver.resolve(null);

        assertEquals(SchedulingPreferences.defaults(), resolved);
        assertEquals(LocalTime.of(9, 0), resolved.getWorkStart());
        assertEquals(LocalTime.of(17, 0), resolved.getWorkEnd());
        assertEquals(15, resolved.getBreakMinutes());
        assertEquals(90, resolved.getFocusSessionMinutes());
        assertEquals(ZoneId.of("UTC"), resolved.getTimeZone());
        assertEquals(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), resolved.getWorkDays());
    }

    @Test
    @DisplayName("Request fields override defaults, absent fields keep them")
    void testResolve_PartialOverride() {
        PreferencesDto requested = PreferencesDto.builder()
                .workingHours(new PreferencesDto.WorkingHours("08:30", null))
                .breakDuration(5)
                .timezone("Europe/Berlin")
                .build();

        SchedulingPreferences resolved = resolver.resolve(requested);

        assertEquals(LocalTime.of(8, 30), resolved.getWorkStart());
        assertEquals(LocalTime.of(17, 0), resolved.getWorkEnd());
        assertEquals(5, resolved.getBreakMinutes());
        assertEquals(ZoneId.of("Europe/Berlin"), resolved.getTimeZone());
        assertEquals(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), resolved.getWorkDays());
    }

    @Test
    @DisplayName("Configured defaults are used when the request omits a field")
    void testResolve_ConfiguredDefaults() {
        properties.setWorkStart("07:00");
        properties.setWorkDays(List.of(6, 7));

        SchedulingPreferences resolved = resolver.resolve(new PreferencesDto());

        assertEquals(LocalTime.of(7, 0), resolved.getWorkStart());
        assertEquals(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY), resolved.getWorkDays());
    }

    @Test
    @DisplayName("Weekday 0 is accepted as Sunday")
    void testResolve_ZeroIsSunday() {
        PreferencesDto requested = PreferencesDto.builder().workDays(List.of(0, 1)).build();

        assertEquals(EnumSet.of(DayOfWeek.SUNDAY, DayOfWeek.MONDAY), resolver.resolve(requested).getWorkDays());
    }

    @Test
    @DisplayName("Empty work days are rejected")
    void testResolve_EmptyWorkDays() {
        PreferencesDto requested = PreferencesDto.builder().workDays(List.of()).build();

        assertThrows(InvalidScheduleRequestException.class, () -> resolver.resolve(requested));
    }

    @Test
    @DisplayName("Out-of-range weekday numbers are rejected")
    void testResolve_InvalidWorkDay() {
        PreferencesDto requested = PreferencesDto.builder().workDays(List.of(1, 8)).build();

        assertThrows(InvalidScheduleRequestException.class, () -> resolver.resolve(requested));
    }

    @Test
    @DisplayName("Malformed time, unknown zone and negative break are rejected")
    void testResolve_InvalidValues() {
        assertThrows(InvalidScheduleRequestException.class, () -> resolver.resolve(
                PreferencesDto.builder().workingHours(new PreferencesDto.WorkingHours("9am", "17:00")).build()));
        assertThrows(InvalidScheduleRequestException.class, () -> resolver.resolve(
                PreferencesDto.builder().timezone("Mars/Olympus").build()));
        assertThrows(InvalidScheduleRequestException.class, () -> resolver.resolve(
                PreferencesDto.builder().breakDuration(-1).build()));
    }

    @Test
    @DisplayName("Single-digit hours are accepted")
    void testResolve_SingleDigitHour() {
        PreferencesDto requested = PreferencesDto.builder()
                .workingHours(new PreferencesDto.WorkingHours("9:00", "17:30"))
                .build();

        SchedulingPreferences resolved = resolver.resolve(requested);

        assertEquals(LocalTime.of(9, 0), resolved.getWorkStart());
        assertEquals(LocalTime.of(17, 30), resolved.getWorkEnd());
    }

    @Test
    @DisplayName("Out-of-range or seconds-bearing times are rejected")
    void testResolve_StrictTimes() {
        assertThrows(InvalidScheduleRequestException.class, () -> resolver.resolve(
                PreferencesDto.builder().workingHours(new PreferencesDto.WorkingHours("24:00", null)).build()));
        assertThrows(InvalidScheduleRequestException.class, () -> resolver.resolve(
                PreferencesDto.builder().workingHours(new PreferencesDto.WorkingHours("09:00:30", null)).build()));
        assertThrows(InvalidScheduleRequestException.class, () -> resolver.resolve(
                PreferencesDto.builder().workingHours(new PreferencesDto.WorkingHours("9:5", null)).build()));
    }

    @Test
    @DisplayName("Invalid configured defaults fail construction instead of each request")
    void testConstructor_InvalidDefaults() {
        PlannerProperties noWorkDays = new PlannerProperties();
        noWorkDays.setWorkDays(List.of());
        PlannerProperties inverted = new PlannerProperties();
        inverted.setWorkStart("18:00");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> new PreferencesResolver(noWorkDays));
        assertTrue(ex.getMessage().contains("planner.defaults"));
        assertThrows(IllegalStateException.class, () -> new PreferencesResolver(inverted));
    }
}
