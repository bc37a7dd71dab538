package io.github.riemr.committee.scheduling.deadline;

import io.github.riemr.committee.application.dto.SlaMilestones;
import io.github.riemr.committee.application.dto.StageDeadlines;
import io.github.riemr.committee.domain.model.Route;
import io.github.riemr.committee.domain.model.SlaDefaults;
import io.github.riemr.committee.exception.DateOrderingViolationException;
import io.github.riemr.committee.exception.InvalidRouteConfigException;
import io.github.riemr.committee.scheduling.calendar.BusinessCalendar;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Back-calculates the SLA stage chain of a route from a meeting date.
 */
@Service
public class DeadlineCalculator {

    public StageDeadlines computeStageDeadlines(BusinessCalendar calendar,
                                                LocalDate meetingDate,
                                                Route route,
                                                LocalDate callPublicationDate,
                                                SlaDefaults slaDefaults) {
        if (meetingDate == null) throw new IllegalArgumentException("meetingDate is required");
        if (route == null) throw new InvalidRouteConfigException(null, "route is required");
        SlaDefaults defaults = slaDefaults == null ? SlaDefaults.standard() : slaDefaults;

        int total = resolve(route, "totalSlaDays", route.getTotalSlaDays(), defaults.getTotalSlaDays());
        int a = resolve(route, "stageADays", route.getStageADays(), defaults.getStageADays());
        int b = resolve(route, "stageBDays", route.getStageBDays(), defaults.getStageBDays());
        int c = resolve(route, "stageCDays", route.getStageCDays(), defaults.getStageCDays());
        int d = resolve(route, "stageDDays", route.getStageDDays(), defaults.getStageDDays());
        if (total < a + b + c) {
            throw new InvalidRouteConfigException(route.getId(),
                    "totalSlaDays " + total + " is shorter than stages A+B+C (" + (a + b + c) + ")");
        }
        if (callPublicationDate != null && callPublicationDate.isAfter(meetingDate)) {
            throw new DateOrderingViolationException(
                    "call publication " + callPublicationDate + " is after meeting " + meetingDate);
        }

        LocalDate callStart = callPublicationDate != null
                ? callPublicationDate
                : calendar.stepBusinessDays(meetingDate, -total);
        LocalDate callDeadline = calendar.stepBusinessDays(callStart, a);
        LocalDate intakeDeadline = calendar.stepBusinessDays(callDeadline, b);
        LocalDate reviewDeadline = calendar.stepBusinessDays(intakeDeadline, c);
        if (reviewDeadline.isAfter(meetingDate)) {
            throw new DateOrderingViolationException(
                    "review deadline " + reviewDeadline + " falls after meeting " + meetingDate);
        }
        LocalDate responseDeadline = calendar.stepBusinessDays(meetingDate, d);

        return StageDeadlines.builder()
                .callStart(callStart)
                .callDeadline(callDeadline)
                .intakeDeadline(intakeDeadline)
                .reviewDeadline(reviewDeadline)
                .meetingDate(meetingDate)
                .responseDeadline(responseDeadline)
                .build();
    }

    /**
     * Request deadline, preparation start and notification date ahead of a meeting, plus the business days
     * left from {@code referenceDate} (usually today).
     */
    public SlaMilestones computeSlaMilestones(BusinessCalendar calendar,
                                              LocalDate meetingDate,
                                              LocalDate referenceDate,
                                              SlaDefaults slaDefaults) {
        SlaDefaults defaults = slaDefaults == null ? SlaDefaults.standard() : slaDefaults;
        int before = defaults.getSlaDaysBefore();
        LocalDate reference = Objects.requireNonNull(referenceDate, "referenceDate");
        return SlaMilestones.builder()
                .meetingDate(meetingDate)
                .requestDeadline(calendar.stepBusinessDays(meetingDate, -before))
                .preparationStart(calendar.stepBusinessDays(meetingDate, -(before + 7)))
                .notificationDate(calendar.stepBusinessDays(meetingDate, -(before + 14)))
                .businessDaysUntilMeeting(reference.isAfter(meetingDate)
                        ? 0
                        : calendar.businessDaysIn(reference, meetingDate).size())
                .build();
    }

    private static int resolve(Route route, String field, Integer value, int fallback) {
        int v = value == null ? fallback : value;
        if (v < 0) {
            throw new InvalidRouteConfigException(route.getId(), field + " must be >= 0 but was " + v);
        }
        return v;
    }
}
