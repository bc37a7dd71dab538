package io.github.riemr.committee.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Funding-request item attached to a meeting and a route, carrying its SLA stage deadlines.
 */
@Value
@Builder(toBuilder = true)
public class Event {
    Long id;
    Long meetingId;
    Long routeId;
    String name;
    int expectedRequests;
    LocalDate callPublicationDate;
    LocalDate callDeadlineDate;
    LocalDate intakeDeadlineDate;
    LocalDate reviewDeadlineDate;
    LocalDate responseDeadlineDate;
}
