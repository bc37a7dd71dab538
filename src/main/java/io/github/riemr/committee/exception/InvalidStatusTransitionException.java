package io.github.riemr.committee.exception;

import io.github.riemr.committee.domain.model.MeetingStatus;

public class InvalidStatusTransitionException extends SchedulingException {
    public InvalidStatusTransitionException(Long meetingId, MeetingStatus from, MeetingStatus to) {
        super(SchedulingErrorKind.INVALID_STATUS_TRANSITION,
                "Meeting " + meetingId + " cannot move from " + from + " to " + to);
    }
}
