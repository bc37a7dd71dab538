package io.github.riemr.committee.domain.model;

import io.github.riemr.committee.exception.InvalidStatusTransitionException;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One dated occurrence (vaada) of a committee type.
 */
@Value
@Builder(toBuilder = true)
public class CommitteeMeeting {
    Long id;
    Long committeeTypeId;
    Long divisionId;
    LocalDate date;
    @Builder.Default
    MeetingStatus status = MeetingStatus.PLANNED;
    Long exceptionDateId;
    String notes;

    public boolean isActive() {
        return status == null || status.isActive();
    }

    public CommitteeMeeting withStatus(MeetingStatus target) {
        MeetingStatus current = status == null ? MeetingStatus.PLANNED : status;
        if (!current.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(id, current, target);
        }
        return toBuilder().status(target).build();
    }

    /** Whether this meeting holds the (committee type, division, date) slot. */
    public boolean occupies(Long committeeTypeId, Long divisionId, LocalDate date) {
        return isActive()
                && Objects.equals(this.committeeTypeId, committeeTypeId)
                && Objects.equals(this.divisionId, divisionId)
                && Objects.equals(this.date, date);
    }
}
