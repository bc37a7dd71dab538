package io.github.riemr.committee.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Defaults for settings that are missing or malformed in the app_setting table.
 */
@Data
@Validated
@ConfigurationProperties("committee.scheduling")
public class SchedulingProperties {

    @NotNull
    private AdmissionPolicy enforcement = AdmissionPolicy.WARN;

    /** 0 = Sunday ... 6 = Saturday */
    @NotEmpty
    private List<@Min(0) @Max(6) Integer> workDays = new ArrayList<>(List.of(0, 1, 2, 3, 4));

    @Valid
    private Capacity capacity = new Capacity();

    @Valid
    private Sla sla = new Sla();

    /** Creates missing tables on startup. */
    private boolean schemaInit = true;

    /** Extra calendar days of exception dates loaded around a snapshot range. */
    @Min(0)
    private int calendarPaddingDays = 180;

    @Data
    public static class Capacity {
        @Min(0) @Max(10)
        private int maxMeetingsPerDay = 1;
        @Min(0) @Max(30)
        private int maxWeeklyMeetings = 3;
        @Min(0) @Max(30)
        private int maxThirdWeekMeetings = 4;
        @Min(0) @Max(1000)
        private int maxRequestsPerDay = 100;
    }

    @Data
    public static class Sla {
        @Min(1)
        private int totalDays = 45;
        @Min(0)
        private int stageADays = 10;
        @Min(0)
        private int stageBDays = 15;
        @Min(0)
        private int stageCDays = 10;
        @Min(0)
        private int stageDDays = 10;
        @Min(1) @Max(180)
        private int daysBefore = 14;
    }
}
