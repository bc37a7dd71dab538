package io.github.riemr.committee.domain.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable view of everything the engine reads for one request: calendar, limits, master data,
 * and the meetings and events of the period of interest.
 */
@Value
public class ConfigurationSnapshot {
    WorkCalendar workCalendar;
    CapacityLimits capacityLimits;
    SlaDefaults slaDefaults;
    RecommendationWeights recommendationWeights;
    List<Division> divisions;
    List<Route> routes;
    List<CommitteeType> committeeTypes;
    List<CommitteeMeeting> meetings;
    List<Event> events;

    @Getter(AccessLevel.NONE) Map<Long, Division> divisionById;
    @Getter(AccessLevel.NONE) Map<Long, Route> routeById;
    @Getter(AccessLevel.NONE) Map<Long, CommitteeType> committeeTypeById;
    @Getter(AccessLevel.NONE) Map<Long, CommitteeMeeting> meetingById;

    @Builder(toBuilder = true)
    public ConfigurationSnapshot(WorkCalendar workCalendar,
                                 CapacityLimits capacityLimits,
                                 SlaDefaults slaDefaults,
                                 RecommendationWeights recommendationWeights,
                                 Collection<Division> divisions,
                                 Collection<Route> routes,
                                 Collection<CommitteeType> committeeTypes,
                                 Collection<CommitteeMeeting> meetings,
                                 Collection<Event> events) {
        if (workCalendar == null) throw new IllegalArgumentException("workCalendar is required");
        if (capacityLimits == null) throw new IllegalArgumentException("capacityLimits is required");
        this.workCalendar = workCalendar;
        this.capacityLimits = capacityLimits;
        this.slaDefaults = slaDefaults == null ? SlaDefaults.standard() : slaDefaults;
        this.recommendationWeights = recommendationWeights == null ? RecommendationWeights.defaults() : recommendationWeights;
        this.divisions = copy(divisions);
        this.routes = copy(routes);
        this.committeeTypes = copy(committeeTypes);
        this.meetings = copy(meetings);
        this.events = copy(events);

        requireUniqueActiveNames("division", this.divisions.stream()
                .filter(Division::isActive).map(Division::getName).collect(Collectors.toList()));

        this.divisionById = index(this.divisions, Division::getId);
        this.routeById = index(this.routes, Route::getId);
        this.committeeTypeById = index(this.committeeTypes, CommitteeType::getId);
        this.meetingById = index(this.meetings, CommitteeMeeting::getId);
    }

    public Optional<Division> division(Long id) {
        return Optional.ofNullable(divisionById.get(id));
    }

    public Optional<Route> route(Long id) {
        return Optional.ofNullable(routeById.get(id));
    }

    public Optional<CommitteeType> committeeType(Long id) {
        return Optional.ofNullable(committeeTypeById.get(id));
    }

    public Optional<CommitteeMeeting> meeting(Long id) {
        return Optional.ofNullable(meetingById.get(id));
    }

    public List<CommitteeMeeting> activeMeetingsOn(LocalDate date) {
        return meetings.stream()
                .filter(CommitteeMeeting::isActive)
                .filter(m -> date.equals(m.getDate()))
                .collect(Collectors.toList());
    }

    /** Non-cancelled meetings in the inclusive range. */
    public List<CommitteeMeeting> activeMeetingsBetween(LocalDate from, LocalDate to) {
        return meetings.stream()
                .filter(CommitteeMeeting::isActive)
                .filter(m -> m.getDate() != null && !m.getDate().isBefore(from) && !m.getDate().isAfter(to))
                .collect(Collectors.toList());
    }

    public List<Event> eventsOf(Long meetingId) {
        return events.stream()
                .filter(e -> meetingId != null && meetingId.equals(e.getMeetingId()))
                .collect(Collectors.toList());
    }

    /** Expected requests of events attached to non-cancelled meetings on the date. */
    public int requestLoadOn(LocalDate date) {
        return activeMeetingsOn(date).stream()
                .mapToInt(m -> eventsOf(m.getId()).stream().mapToInt(Event::getExpectedRequests).sum())
                .sum();
    }

    private static <T> List<T> copy(Collection<T> source) {
        return source == null ? List.of() : Collections.unmodifiableList(List.copyOf(source));
    }

    private static <T> Map<Long, T> index(List<T> items, java.util.function.Function<T, Long> idOf) {
        Map<Long, T> map = new LinkedHashMap<>();
        for (T item : items) {
            Long id = idOf.apply(item);
            if (id != null) map.put(id, item);
        }
        return Collections.unmodifiableMap(map);
    }

    private static void requireUniqueActiveNames(String what, List<String> names) {
        long distinct = names.stream().filter(n -> n != null).distinct().count();
        long total = names.stream().filter(n -> n != null).count();
        if (distinct != total) {
            throw new IllegalArgumentException("active " + what + " names must be unique");
        }
    }
}
