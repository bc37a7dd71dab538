package io.github.riemr.committee.application.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class CommitteeRecommendation {
    Long meetingId;
    Long committeeTypeId;
    String committeeTypeName;
    LocalDate date;
    long daysUntilMeeting;
    int availableCapacity;
    int eventCount;
    double score;
    boolean available;
    boolean best;
    List<String> reasons;
    List<String> warnings;
}
