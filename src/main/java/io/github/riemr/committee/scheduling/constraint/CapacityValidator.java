package io.github.riemr.committee.scheduling.constraint;

import io.github.riemr.committee.application.dto.CapacityCounts;
import io.github.riemr.committee.application.dto.Decision;
import io.github.riemr.committee.application.dto.Violation;
import io.github.riemr.committee.application.dto.ViolationType;
import io.github.riemr.committee.domain.model.CapacityLimits;
import io.github.riemr.committee.domain.model.CommitteeMeeting;
import io.github.riemr.committee.domain.model.ConfigurationSnapshot;
import io.github.riemr.committee.domain.model.Event;
import io.github.riemr.committee.scheduling.calendar.BusinessCalendar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a candidate meeting date against the daily, weekly and request-load ceilings.
 * All rules are evaluated; the result lists every violation.
 */
@Slf4j
@Service
public class CapacityValidator {

    public Decision checkCapacity(ConfigurationSnapshot snapshot, LocalDate candidateDate, int proposedRequests) {
        return checkCapacity(BusinessCalendar.of(snapshot.getWorkCalendar()), candidateDate,
                snapshot.getMeetings(), snapshot.getEvents(), snapshot.getCapacityLimits(), proposedRequests);
    }

    public Decision checkCapacity(BusinessCalendar calendar,
                                  LocalDate candidateDate,
                                  Collection<CommitteeMeeting> existingMeetings,
                                  Collection<Event> existingEvents,
                                  CapacityLimits limits,
                                  int proposedRequests) {
        CapacityCounts counts = count(calendar, candidateDate, existingMeetings, existingEvents, limits, proposedRequests);
        List<Violation> violations = new ArrayList<>();

        if (counts.meetingsOnDay() >= limits.getMaxMeetingsPerDay()) {
            violations.add(new Violation(ViolationType.DAILY_MEETING_CAP,
                    "daily meeting cap exceeded: " + counts.meetingsOnDay() + "/" + limits.getMaxMeetingsPerDay()));
        }
        if (counts.meetingsInWeek() >= counts.weeklyLimit()) {
            violations.add(counts.thirdWeek()
                    ? new Violation(ViolationType.THIRD_WEEK_MEETING_CAP,
                        "third-week meeting cap exceeded: " + counts.meetingsInWeek() + "/" + counts.weeklyLimit())
                    : new Violation(ViolationType.WEEKLY_MEETING_CAP,
                        "weekly meeting cap exceeded: " + counts.meetingsInWeek() + "/" + counts.weeklyLimit()));
        }
        Violation load = requestLoadViolation(counts, limits);
        if (load != null) violations.add(load);

        Decision decision = Decision.of(violations, counts);
        log.debug("Capacity check {} -> ok={} counts={}", candidateDate, decision.isOk(), counts);
        return decision;
    }

    /**
     * Request ceiling only, for adding events to a meeting that already exists on the date.
     */
    public Decision checkRequestLoad(ConfigurationSnapshot snapshot, LocalDate date, int proposedRequests) {
        BusinessCalendar calendar = BusinessCalendar.of(snapshot.getWorkCalendar());
        CapacityLimits limits = snapshot.getCapacityLimits();
        CapacityCounts counts = count(calendar, date, snapshot.getMeetings(), snapshot.getEvents(), limits, proposedRequests);
        Violation load = requestLoadViolation(counts, limits);
        return Decision.of(load == null ? List.of() : List.of(load), counts);
    }

    CapacityCounts count(BusinessCalendar calendar,
                         LocalDate date,
                         Collection<CommitteeMeeting> meetings,
                         Collection<Event> events,
                         CapacityLimits limits,
                         int proposedRequests) {
        Objects.requireNonNull(date, "candidateDate");
        if (proposedRequests < 0) throw new IllegalArgumentException("proposedRequests must be >= 0");
        List<CommitteeMeeting> active = meetings == null ? List.of() : meetings.stream()
                .filter(CommitteeMeeting::isActive)
                .filter(m -> m.getDate() != null)
                .collect(Collectors.toList());

        LocalDate weekStart = calendar.weekStart(date);
        LocalDate weekEnd = calendar.weekEnd(date);
        int onDay = 0;
        int inWeek = 0;
        for (CommitteeMeeting m : active) {
            if (m.getDate().equals(date)) onDay++;
            if (!m.getDate().isBefore(weekStart) && !m.getDate().isAfter(weekEnd)) inWeek++;
        }

        Set<Long> meetingIdsOnDay = active.stream()
                .filter(m -> m.getDate().equals(date))
                .map(CommitteeMeeting::getId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        int requests = events == null ? 0 : events.stream()
                .filter(e -> meetingIdsOnDay.contains(e.getMeetingId()))
                .mapToInt(Event::getExpectedRequests)
                .sum();

        boolean thirdWeek = BusinessCalendar.isThirdWeek(date);
        return new CapacityCounts(onDay, inWeek, limits.weeklyLimit(thirdWeek), thirdWeek, requests + proposedRequests);
    }

    private static Violation requestLoadViolation(CapacityCounts counts, CapacityLimits limits) {
        if (counts.requestLoad() <= limits.getMaxRequestsPerDay()) return null;
        return new Violation(ViolationType.DAILY_REQUEST_LOAD,
                "daily request load exceeded: " + counts.requestLoad() + "/" + limits.getMaxRequestsPerDay());
    }
}
