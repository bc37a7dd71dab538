package io.github.riemr.committee.application.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class SlaMilestones {
    LocalDate meetingDate;
    LocalDate requestDeadline;
    LocalDate preparationStart;
    LocalDate notificationDate;
    /** Business days from the reference date to the meeting date, both inclusive. */
    int businessDaysUntilMeeting;
}
