package io.github.riemr.committee.exception;

public enum SchedulingErrorKind {
    INVALID_ROUTE_CONFIG,
    INVALID_COMMITTEE_TYPE_CONFIG,
    DATE_ORDERING_VIOLATION,
    EMPTY_CALENDAR_CONFIG,
    INVALID_STATUS_TRANSITION,
    INVALID_SEARCH_WINDOW
}
