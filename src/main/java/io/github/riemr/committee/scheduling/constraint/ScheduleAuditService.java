package io.github.riemr.committee.scheduling.constraint;

import io.github.riemr.committee.application.dto.AuditIssue;
import io.github.riemr.committee.application.dto.ScheduleAuditReport;
import io.github.riemr.committee.application.dto.ViolationType;
import io.github.riemr.committee.domain.model.CapacityLimits;
import io.github.riemr.committee.domain.model.CommitteeMeeting;
import io.github.riemr.committee.domain.model.ConfigurationSnapshot;
import io.github.riemr.committee.scheduling.calendar.BusinessCalendar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Re-checks an existing month of meetings and reports every rule it breaks.
 */
@Slf4j
@Service
public class ScheduleAuditService {

    public ScheduleAuditReport audit(ConfigurationSnapshot snapshot, YearMonth month) {
        BusinessCalendar calendar = BusinessCalendar.of(snapshot.getWorkCalendar());
        CapacityLimits limits = snapshot.getCapacityLimits();
        List<CommitteeMeeting> meetings = snapshot.activeMeetingsBetween(month.atDay(1), month.atEndOfMonth());
        List<AuditIssue> issues = new ArrayList<>();

        for (CommitteeMeeting m : meetings) {
            calendar.closedReason(m.getDate()).ifPresent(reason ->
                    issues.add(new AuditIssue(m.getDate(), ViolationType.NON_BUSINESS_DAY,
                            "meeting " + m.getId() + " " + reason)));
        }

        Map<LocalDate, Long> perDay = meetings.stream()
                .collect(Collectors.groupingBy(CommitteeMeeting::getDate, TreeMap::new, Collectors.counting()));
        perDay.forEach((date, n) -> {
            if (n > limits.getMaxMeetingsPerDay()) {
                issues.add(new AuditIssue(date, ViolationType.DAILY_MEETING_CAP,
                        "daily meeting cap exceeded: " + n + "/" + limits.getMaxMeetingsPerDay()));
            }
        });

        Map<LocalDate, List<CommitteeMeeting>> perWeek = meetings.stream()
                .collect(Collectors.groupingBy(m -> calendar.weekStart(m.getDate()), TreeMap::new, Collectors.toList()));
        perWeek.forEach((weekStart, inMonth) -> {
            int n = snapshot.activeMeetingsBetween(weekStart, calendar.weekEnd(weekStart)).size();
            boolean thirdWeek = inMonth.stream().anyMatch(m -> BusinessCalendar.isThirdWeek(m.getDate()));
            int limit = limits.weeklyLimit(thirdWeek);
            if (n > limit) {
                issues.add(thirdWeek
                        ? new AuditIssue(weekStart, ViolationType.THIRD_WEEK_MEETING_CAP,
                            "third-week meeting cap exceeded: " + n + "/" + limit)
                        : new AuditIssue(weekStart, ViolationType.WEEKLY_MEETING_CAP,
                            "weekly meeting cap exceeded: " + n + "/" + limit));
            }
        });

        Map<String, List<CommitteeMeeting>> slots = meetings.stream()
                .collect(Collectors.groupingBy(m -> m.getCommitteeTypeId() + "/" + m.getDivisionId() + "/" + m.getDate(),
                        TreeMap::new, Collectors.toList()));
        slots.values().stream()
                .filter(group -> group.size() > 1)
                .forEach(group -> issues.add(new AuditIssue(group.get(0).getDate(), ViolationType.DUPLICATE_SLOT,
                        group.size() + " meetings of committee type " + group.get(0).getCommitteeTypeId()
                                + " on " + group.get(0).getDate())));

        log.info("Audited {}: {} meetings, {} issues", month, meetings.size(), issues.size());
        return new ScheduleAuditReport(month, meetings.size(), issues);
    }
}
