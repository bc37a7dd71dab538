package io.github.riemr.committee.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Organisational unit (hativa) owning routes and committee types.
 */
@Value
@Builder
public class Division {
    Long id;
    String name;
    String color;
    @Builder.Default
    boolean active = true;
    /** Weekdays on which this division may hold meetings; empty means no restriction. */
    @Builder.Default
    Set<Integer> allowedWeekdays = Set.of();

    public boolean isWeekdayAllowed(int weekday) {
        return allowedWeekdays == null || allowedWeekdays.isEmpty() || allowedWeekdays.contains(weekday);
    }
}
