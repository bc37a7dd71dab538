package io.github.riemr.committee.application.dto;

public enum ViolationType {
    DAILY_MEETING_CAP,
    WEEKLY_MEETING_CAP,
    THIRD_WEEK_MEETING_CAP,
    DAILY_REQUEST_LOAD,
    NON_BUSINESS_DAY,
    DIVISION_WEEKDAY_NOT_ALLOWED,
    DUPLICATE_SLOT
}
