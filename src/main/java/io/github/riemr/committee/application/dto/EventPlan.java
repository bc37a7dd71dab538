package io.github.riemr.committee.application.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EventPlan {
    Long meetingId;
    Long routeId;
    int expectedRequests;
    StageDeadlines deadlines;
    Decision requestLoad;
}
