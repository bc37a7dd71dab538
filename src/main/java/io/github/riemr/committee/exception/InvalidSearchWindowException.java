package io.github.riemr.committee.exception;

public class InvalidSearchWindowException extends SchedulingException {
    public InvalidSearchWindowException(String detail) {
        super(SchedulingErrorKind.INVALID_SEARCH_WINDOW, detail);
    }
}
