package io.github.riemr.committee.exception;

public class EmptyCalendarConfigException extends SchedulingException {
    public EmptyCalendarConfigException() {
        super(SchedulingErrorKind.EMPTY_CALENDAR_CONFIG, "No working weekdays configured");
    }
}
