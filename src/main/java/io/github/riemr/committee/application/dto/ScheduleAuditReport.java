package io.github.riemr.committee.application.dto;

import java.time.YearMonth;
import java.util.List;

public record ScheduleAuditReport(YearMonth month, int meetingsChecked, List<AuditIssue> issues) {
    public ScheduleAuditReport {
        issues = List.copyOf(issues);
    }

    public boolean isClean() {
        return issues.isEmpty();
    }
}
