package io.github.riemr.committee.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Meeting and request ceilings. Zero means nothing is permitted, not unlimited.
 */
@Value
public class CapacityLimits {
    int maxMeetingsPerDay;
    int maxMeetingsPerStandardWeek;
    int maxMeetingsPerThirdWeek;
    int maxRequestsPerDay;

    @Builder
    public CapacityLimits(int maxMeetingsPerDay, int maxMeetingsPerStandardWeek,
                          int maxMeetingsPerThirdWeek, int maxRequestsPerDay) {
        requireNonNegative("maxMeetingsPerDay", maxMeetingsPerDay);
        requireNonNegative("maxMeetingsPerStandardWeek", maxMeetingsPerStandardWeek);
        requireNonNegative("maxMeetingsPerThirdWeek", maxMeetingsPerThirdWeek);
        requireNonNegative("maxRequestsPerDay", maxRequestsPerDay);
        this.maxMeetingsPerDay = maxMeetingsPerDay;
        this.maxMeetingsPerStandardWeek = maxMeetingsPerStandardWeek;
        this.maxMeetingsPerThirdWeek = maxMeetingsPerThirdWeek;
        this.maxRequestsPerDay = maxRequestsPerDay;
    }

    public int weeklyLimit(boolean thirdWeek) {
        return thirdWeek ? maxMeetingsPerThirdWeek : maxMeetingsPerStandardWeek;
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) throw new IllegalArgumentException(name + " must be >= 0");
    }
}
