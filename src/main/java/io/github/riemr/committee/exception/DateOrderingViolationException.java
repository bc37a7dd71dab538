package io.github.riemr.committee.exception;

public class DateOrderingViolationException extends SchedulingException {
    public DateOrderingViolationException(String detail) {
        super(SchedulingErrorKind.DATE_ORDERING_VIOLATION, detail);
    }
}
