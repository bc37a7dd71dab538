package io.github.riemr.committee.application.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class MeetingSuggestion {
    Long committeeTypeId;
    String committeeTypeName;
    Long divisionId;
    LocalDate date;
    int weekday;
}
