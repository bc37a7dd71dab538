package io.github.riemr.committee.scheduling.deadline;

import io.github.riemr.committee.application.dto.Decision;
import io.github.riemr.committee.application.dto.EventDeadlineUpdate;
import io.github.riemr.committee.application.dto.EventPlan;
import io.github.riemr.committee.application.dto.StageDeadlines;
import io.github.riemr.committee.domain.model.CommitteeMeeting;
import io.github.riemr.committee.domain.model.ConfigurationSnapshot;
import io.github.riemr.committee.domain.model.Event;
import io.github.riemr.committee.domain.model.Route;
import io.github.riemr.committee.exception.InvalidRouteConfigException;
import io.github.riemr.committee.exception.SchedulingException;
import io.github.riemr.committee.scheduling.calendar.BusinessCalendar;
import io.github.riemr.committee.scheduling.constraint.CapacityValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Deadline planning for events attached to meetings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventDeadlineService {
    private final DeadlineCalculator deadlineCalculator;
    private final CapacityValidator capacityValidator;

    /**
     * Stage deadlines and the request-load check for a new event on an existing meeting.
     */
    public EventPlan planEvent(ConfigurationSnapshot snapshot,
                               Long meetingId,
                               Long routeId,
                               int expectedRequests,
                               LocalDate callPublicationDate) {
        if (expectedRequests < 0) throw new IllegalArgumentException("expectedRequests must be >= 0");
        CommitteeMeeting meeting = snapshot.meeting(meetingId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown meeting: " + meetingId));
        if (!meeting.isActive()) {
            throw new IllegalArgumentException("Meeting " + meetingId + " is cancelled");
        }
        Route route = snapshot.route(routeId)
                .orElseThrow(() -> new InvalidRouteConfigException(routeId, "route not found"));
        if (!Objects.equals(route.getDivisionId(), meeting.getDivisionId())) {
            throw new InvalidRouteConfigException(routeId,
                    "belongs to division " + route.getDivisionId() + " but meeting is in division " + meeting.getDivisionId());
        }

        BusinessCalendar calendar = BusinessCalendar.of(snapshot.getWorkCalendar());
        StageDeadlines deadlines = deadlineCalculator.computeStageDeadlines(
                calendar, meeting.getDate(), route, callPublicationDate, snapshot.getSlaDefaults());
        Decision load = capacityValidator.checkRequestLoad(snapshot, meeting.getDate(), expectedRequests);
        if (!load.isOk()) {
            log.info("Event on meeting {} ({}) exceeds request load: {}", meetingId, meeting.getDate(), load.messages());
        }
        return EventPlan.builder()
                .meetingId(meetingId)
                .routeId(routeId)
                .expectedRequests(expectedRequests)
                .deadlines(deadlines)
                .requestLoad(load)
                .build();
    }

    /**
     * Recomputes deadlines of every event (or only the events of {@code routeId}) and returns those that changed.
     * Events on cancelled or unknown meetings are left alone.
     */
    public List<EventDeadlineUpdate> recalculate(ConfigurationSnapshot snapshot, Long routeId) {
        BusinessCalendar calendar = BusinessCalendar.of(snapshot.getWorkCalendar());
        List<EventDeadlineUpdate> updates = new ArrayList<>();
        int skipped = 0;
        for (Event event : snapshot.getEvents()) {
            if (routeId != null && !routeId.equals(event.getRouteId())) continue;
            Optional<CommitteeMeeting> meeting = snapshot.meeting(event.getMeetingId()).filter(CommitteeMeeting::isActive);
            Optional<Route> route = snapshot.route(event.getRouteId());
            if (meeting.isEmpty() || route.isEmpty()) {
                skipped++;
                continue;
            }
            StageDeadlines deadlines;
            try {
                deadlines = deadlineCalculator.computeStageDeadlines(calendar, meeting.get().getDate(), route.get(),
                        event.getCallPublicationDate(), snapshot.getSlaDefaults());
            } catch (SchedulingException e) {
                log.warn("Cannot recalculate deadlines of event {}: {}", event.getId(), e.getMessage());
                skipped++;
                continue;
            }
            Event updated = event.toBuilder()
                    .callDeadlineDate(deadlines.getCallDeadline())
                    .intakeDeadlineDate(deadlines.getIntakeDeadline())
                    .reviewDeadlineDate(deadlines.getReviewDeadline())
                    .responseDeadlineDate(deadlines.getResponseDeadline())
                    .build();
            if (!updated.equals(event)) {
                updates.add(new EventDeadlineUpdate(event, updated));
            }
        }
        log.info("Recalculated event deadlines (route={}): {} changed, {} skipped", routeId, updates.size(), skipped);
        return updates;
    }
}
