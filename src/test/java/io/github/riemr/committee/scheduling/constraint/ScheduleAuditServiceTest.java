package io.github.riemr.committee.scheduling.constraint;

import io.github.riemr.committee.application.dto.AuditIssue;
import io.github.riemr.committee.application.dto.ScheduleAuditReport;
import io.github.riemr.committee.application.dto.ViolationType;
import io.github.riemr.committee.domain.model.ConfigurationSnapshot;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.List;

import static io.github.riemr.committee.scheduling.SchedulingFixtures.DIVISION;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.cancelled;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.d;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.meeting;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;

class ScheduleAuditServiceTest {

    private final ScheduleAuditService service = new ScheduleAuditService();

    @Test
    void cleanMonth_hasNoIssues() {
        ConfigurationSnapshot s = snapshot().meetings(List.of(
                meeting(1L, 10L, DIVISION, "2025-03-05"),
                meeting(2L, 10L, DIVISION, "2025-03-12"))).build();

        ScheduleAuditReport report = service.audit(s, YearMonth.of(2025, 3));

        assertThat(report.isClean()).isTrue();
        assertThat(report.meetingsChecked()).isEqualTo(2);
    }

    @Test
    void brokenMonth_reportsEveryRule() {
        ConfigurationSnapshot s = snapshot().meetings(List.of(
                meeting(1L, 10L, DIVISION, "2025-03-04"),
                meeting(2L, 10L, DIVISION, "2025-03-05"),
                meeting(3L, 10L, DIVISION, "2025-03-05"),
                meeting(4L, 11L, DIVISION, "2025-03-07"),
                cancelled(5L, 12L, DIVISION, "2025-03-06"),
                meeting(6L, 10L, DIVISION, "2025-04-02"))).build();

        ScheduleAuditReport report = service.audit(s, YearMonth.of(2025, 3));

        assertThat(report.meetingsChecked()).isEqualTo(4);
        assertThat(report.issues()).extracting(AuditIssue::type).containsExactlyInAnyOrder(
                ViolationType.NON_BUSINESS_DAY,
                ViolationType.DAILY_MEETING_CAP,
                ViolationType.WEEKLY_MEETING_CAP,
                ViolationType.DUPLICATE_SLOT);
        assertThat(report.issues()).extracting(AuditIssue::message)
                .contains("daily meeting cap exceeded: 2/1", "weekly meeting cap exceeded: 4/3");
        assertThat(report.issues()).filteredOn(i -> i.type() == ViolationType.WEEKLY_MEETING_CAP)
                .extracting(AuditIssue::date).containsExactly(d("2025-03-02"));
    }
}
