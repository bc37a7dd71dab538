package io.github.riemr.committee.domain.model;

import io.github.riemr.committee.exception.InvalidCommitteeTypeConfigException;
import io.github.riemr.committee.util.Weekdays;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Recurrence rule of a committee: a fixed weekday, weekly or on the n-th occurrence of that weekday in a month.
 */
@Value
@Builder(toBuilder = true)
public class CommitteeType {
    Long id;
    Long divisionId;
    String name;
    Integer scheduledWeekday;
    Frequency frequency;
    Integer weekOfMonth;
    boolean operational;
    @Builder.Default
    boolean active = true;

    public void validate() {
        if (!Weekdays.isValid(scheduledWeekday)) {
            throw new InvalidCommitteeTypeConfigException(id, "scheduledWeekday must be 0..6 but was " + scheduledWeekday);
        }
        if (frequency == null) {
            throw new InvalidCommitteeTypeConfigException(id, "frequency is required");
        }
        if (frequency == Frequency.MONTHLY) {
            if (weekOfMonth == null) {
                throw new InvalidCommitteeTypeConfigException(id, "monthly committee requires weekOfMonth");
            }
            if (weekOfMonth < 1 || weekOfMonth > 5) {
                throw new InvalidCommitteeTypeConfigException(id, "weekOfMonth must be 1..5 but was " + weekOfMonth);
            }
        } else if (weekOfMonth != null) {
            throw new InvalidCommitteeTypeConfigException(id, "weekOfMonth is only allowed for monthly committees");
        }
    }

    /** True when the date satisfies the recurrence rule (weekday and, if monthly, week of month). */
    public boolean recursOn(LocalDate date) {
        if (Weekdays.ordinalOf(date) != scheduledWeekday) return false;
        return frequency != Frequency.MONTHLY || Weekdays.occurrenceInMonth(date) == weekOfMonth;
    }
}
