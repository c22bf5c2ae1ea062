package com.prakash.planner.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Default scheduling preferences, applied to every field a request leaves out.
 * <p>
 * Bound to the property prefix <strong>planner.defaults</strong>.
 * </p>
 *
 * Example configuration in <code>application.properties</code>:
 * <pre>
 * planner.defaults.work-start=08:30
 * planner.defaults.work-days=1,2,3,4
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "planner.defaults")
@Validated
public class PlannerProperties {

    /**
     * Start of the working day, {@code HH:mm}.
     */
    @NotBlank
    private String workStart = "09:00";

    /**
     * End of the working day, {@code HH:mm}.
     */
    @NotBlank
    private String workEnd = "17:00";

    @Min(0)
    private int breakDuration = 15;

    @Min(1)
    private int focusSessionLength = 90;

    /**
     * IANA zone id in which working hours and work days are evaluated.
     */
    @NotBlank
    private String timezone = "UTC";

    /**
     * Permitted weekdays, 1 = Monday ... 7 = Sunday.
     */
    @NotEmpty
    private List<Integer> workDays = new ArrayList<>(List.of(1, 2, 3, 4, 5));

    public String getWorkStart() {
        return workStart;
    }

    public void setWorkStart(String workStart) {
        this.workStart = workStart;
    }

    public String getWorkEnd() {
        return workEnd;
    }

    public void setWorkEnd(String workEnd) {
        this.workEnd = workEnd;
    }

    public int getBreakDuration() {
        return breakDuration;
    }

    public void setBreakDuration(int breakDuration) {
        this.breakDuration = breakDuration;
    }

    public int getFocusSessionLength() {
        return focusSessionLength;
    }

    public void setFocusSessionLength(int focusSessionLength) {
        this.focusSessionLength = focusSessionLength;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public List<Integer> getWorkDays() {
        return workDays;
    }

    public void setWorkDays(List<Integer> workDays) {
        this.workDays = workDays;
    }
}
