package io.github.riemr.committee.scheduling.suggestion;

import io.github.riemr.committee.application.dto.CapacityCounts;
import io.github.riemr.committee.application.dto.CommitteeRecommendation;
import io.github.riemr.committee.domain.model.CommitteeMeeting;
import io.github.riemr.committee.domain.model.CommitteeType;
import io.github.riemr.committee.domain.model.ConfigurationSnapshot;
import io.github.riemr.committee.domain.model.RecommendationWeights;
import io.github.riemr.committee.domain.model.Route;
import io.github.riemr.committee.scheduling.constraint.CapacityValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ranks upcoming meetings of a route's division as a home for a new event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommitteeRecommendationService {
    private final CapacityValidator capacityValidator;

    public List<CommitteeRecommendation> recommend(ConfigurationSnapshot snapshot,
                                                   Long routeId,
                                                   int expectedRequests,
                                                   LocalDate referenceDate,
                                                   int limit) {
        if (expectedRequests < 0) throw new IllegalArgumentException("expectedRequests must be >= 0");
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        Optional<Route> route = snapshot.route(routeId);
        if (route.isEmpty()) {
            log.info("No recommendations: route {} not found", routeId);
            return List.of();
        }
        int slaDays = route.get().getTotalSlaDays() != null
                ? route.get().getTotalSlaDays()
                : snapshot.getSlaDefaults().getTotalSlaDays();

        List<CommitteeRecommendation> scored = snapshot.getMeetings().stream()
                .filter(CommitteeMeeting::isActive)
                .filter(m -> route.get().getDivisionId().equals(m.getDivisionId()))
                .filter(m -> !m.getDate().isBefore(referenceDate))
                .map(m -> score(snapshot, m, slaDays, expectedRequests, referenceDate))
                .sorted(Comparator.comparingDouble(CommitteeRecommendation::getScore).reversed()
                        .thenComparing(CommitteeRecommendation::getDate))
                .limit(limit)
                .collect(Collectors.toList());
        log.debug("Recommended {} meetings for route {} ({} requests)", scored.size(), routeId, expectedRequests);
        return scored;
    }

    private CommitteeRecommendation score(ConfigurationSnapshot snapshot,
                                          CommitteeMeeting meeting,
                                          int slaDays,
                                          int expectedRequests,
                                          LocalDate today) {
        RecommendationWeights w = snapshot.getRecommendationWeights();
        LocalDate date = meeting.getDate();
        long daysUntil = ChronoUnit.DAYS.between(today, date);
        double score = w.getBaseScore();
        List<String> reasons = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean available = true;

        int maxRequests = snapshot.getCapacityLimits().getMaxRequestsPerDay();
        int currentRequests = snapshot.requestLoadOn(date);
        int space = maxRequests - currentRequests;
        if (space >= expectedRequests) {
            reasons.add("room for " + expectedRequests + " requests (free " + space + "/" + maxRequests + ")");
            score += w.getSpaceBonus();
        } else {
            warnings.add("not enough room (free " + space + ", needed " + expectedRequests + ")");
            score -= w.getNoSpacePenalty();
            available = false;
        }

        if (daysUntil >= slaDays) {
            long buffer = daysUntil - slaDays;
            reasons.add("enough time for SLA (" + buffer + " extra days)");
            score += Math.min(buffer * 0.5, w.getSlaBonus());
        } else if (daysUntil >= slaDays * 0.8) {
            warnings.add("tight SLA (" + daysUntil + "/" + slaDays + " days)");
            score -= w.getTightSlaPenalty();
        } else {
            warnings.add("not enough time for SLA (needed " + slaDays + ", have " + daysUntil + ")");
            score -= w.getNoSlaPenalty();
            available = false;
        }

        int eventCount = snapshot.eventsOf(meeting.getId()).size();
        if (eventCount == 0) {
            reasons.add("no events yet");
            score += w.getNoEventsBonus();
        } else if (eventCount <= 3) {
            reasons.add("low load (" + eventCount + " events)");
        } else if (eventCount <= 6) {
            warnings.add("medium load (" + eventCount + " events)");
            score -= w.getMediumLoadPenalty();
        } else {
            warnings.add("high load (" + eventCount + " events)");
            score -= w.getHighLoadPenalty();
        }

        long optimalStart = (long) slaDays + w.getOptimalRangeStart();
        long optimalEnd = (long) slaDays + w.getOptimalRangeEnd();
        if (daysUntil >= optimalStart && daysUntil <= optimalEnd) {
            reasons.add("within the optimal range");
            score += w.getOptimalRangeBonus();
        } else if (daysUntil > optimalEnd + w.getFarFutureThreshold()) {
            warnings.add("too far in the future (" + daysUntil + " days)");
            score -= w.getFarFuturePenalty();
        }

        CapacityCounts counts = capacityValidator.checkRequestLoad(snapshot, date, 0).getCounts();
        if (counts.meetingsInWeek() >= counts.weeklyLimit()) {
            warnings.add("week is full (" + counts.meetingsInWeek() + "/" + counts.weeklyLimit() + " meetings)");
            score -= w.getWeekFullPenalty();
            available = false;
        }

        boolean best = available && warnings.isEmpty();
        if (best) {
            score += w.getBestBonus();
            reasons.add(0, "best match");
        }

        String typeName = snapshot.committeeType(meeting.getCommitteeTypeId()).map(CommitteeType::getName).orElse(null);
        return CommitteeRecommendation.builder()
                .meetingId(meeting.getId())
                .committeeTypeId(meeting.getCommitteeTypeId())
                .committeeTypeName(typeName)
                .date(date)
                .daysUntilMeeting(daysUntil)
                .availableCapacity(space)
                .eventCount(eventCount)
                .score(Math.max(0, score))
                .available(available)
                .best(best)
                .reasons(List.copyOf(reasons))
                .warnings(List.copyOf(warnings))
                .build();
    }
}
