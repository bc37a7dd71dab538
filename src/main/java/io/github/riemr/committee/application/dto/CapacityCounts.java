package io.github.riemr.committee.application.dto;

/**
 * Counts observed while checking a candidate date. {@code requestLoad} includes the proposed requests.
 */
public record CapacityCounts(int meetingsOnDay,
                             int meetingsInWeek,
                             int weeklyLimit,
                             boolean thirdWeek,
                             int requestLoad) {
}
