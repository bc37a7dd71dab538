package io.github.riemr.committee.scheduling.constraint;

import io.github.riemr.committee.application.dto.Decision;
import io.github.riemr.committee.application.dto.ViolationType;
import io.github.riemr.committee.domain.model.CommitteeMeeting;
import io.github.riemr.committee.domain.model.ConfigurationSnapshot;
import io.github.riemr.committee.scheduling.calendar.BusinessCalendar;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.riemr.committee.scheduling.SchedulingFixtures.DIVISION;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.cancelled;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.d;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.event;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.limits;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.meeting;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.snapshot;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.sunToThu;
import static org.assertj.core.api.Assertions.assertThat;

class CapacityValidatorTest {

    private final CapacityValidator validator = new CapacityValidator();
    private final BusinessCalendar calendar = BusinessCalendar.of(sunToThu());

    @Test
    void secondMeetingSameWednesday_hitsDailyCap() {
        Decision decision = validator.checkCapacity(calendar, d("2025-03-05"),
                List.of(meeting(1L, 10L, DIVISION, "2025-03-05")), List.of(), limits(1, 3, 4, 100), 0);

        assertThat(decision.isOk()).isFalse();
        assertThat(decision.messages()).containsExactly("daily meeting cap exceeded: 1/1");
        assertThat(decision.getCounts().meetingsOnDay()).isEqualTo(1);
    }

    @Test
    void emptyDay_isOk() {
        Decision decision = validator.checkCapacity(calendar, d("2025-03-05"), List.of(), List.of(), limits(1, 3, 4, 100), 0);

        assertThat(decision.isOk()).isTrue();
        assertThat(decision.getViolations()).isEmpty();
    }

    @Test
    void cancelledMeetings_doNotCount() {
        Decision decision = validator.checkCapacity(calendar, d("2025-03-05"),
                List.of(cancelled(1L, 10L, DIVISION, "2025-03-05")), List.of(), limits(1, 3, 4, 100), 0);

        assertThat(decision.isOk()).isTrue();
    }

    @Test
    void zeroLimit_permitsNothing() {
        Decision decision = validator.checkCapacity(calendar, d("2025-03-05"), List.of(), List.of(), limits(0, 3, 4, 100), 0);

        assertThat(decision.messages()).containsExactly("daily meeting cap exceeded: 0/0");
    }

    @Test
    void standardWeek_usesWeeklyLimit() {
        Decision decision = validator.checkCapacity(calendar, d("2025-03-05"),
                List.of(meeting(1L, 10L, DIVISION, "2025-03-02"), meeting(2L, 11L, DIVISION, "2025-03-03")),
                List.of(), limits(2, 2, 4, 100), 0);

        assertThat(decision.messages()).containsExactly("weekly meeting cap exceeded: 2/2");
        assertThat(decision.has(ViolationType.WEEKLY_MEETING_CAP)).isTrue();
        assertThat(decision.getCounts().thirdWeek()).isFalse();
    }

    @Test
    void meetingsOutsideWorkWeek_doNotCount() {
        // Saturday 8 March closes the week of Wednesday 5 March; Sunday 9 March opens the next
        Decision decision = validator.checkCapacity(calendar, d("2025-03-05"),
                List.of(meeting(1L, 10L, DIVISION, "2025-03-01"), meeting(2L, 11L, DIVISION, "2025-03-09")),
                List.of(), limits(2, 1, 4, 100), 0);

        assertThat(decision.isOk()).isTrue();
        assertThat(decision.getCounts().meetingsInWeek()).isZero();
    }

    @Test
    void thirdWeek_usesHigherLimit() {
        List<CommitteeMeeting> two = List.of(
                meeting(1L, 10L, DIVISION, "2025-03-16"), meeting(2L, 11L, DIVISION, "2025-03-17"));
        assertThat(validator.checkCapacity(calendar, d("2025-03-18"), two, List.of(), limits(2, 2, 3, 100), 0).isOk()).isTrue();

        List<CommitteeMeeting> three = List.of(
                meeting(1L, 10L, DIVISION, "2025-03-16"), meeting(2L, 11L, DIVISION, "2025-03-17"),
                meeting(3L, 12L, DIVISION, "2025-03-19"));
        Decision decision = validator.checkCapacity(calendar, d("2025-03-18"), three, List.of(), limits(2, 2, 3, 100), 0);

        assertThat(decision.messages()).containsExactly("third-week meeting cap exceeded: 3/3");
        assertThat(decision.getCounts().weeklyLimit()).isEqualTo(3);
    }

    @Test
    void requestLoad_isInclusiveCeiling() {
        var meetings = List.of(meeting(1L, 10L, DIVISION, "2025-03-05"));
        var events = List.of(event(100L, 1L, 5L, 60), event(101L, 1L, 5L, 30));

        assertThat(validator.checkCapacity(calendar, d("2025-03-05"), meetings, events, limits(2, 3, 4, 100), 10).isOk()).isTrue();

        Decision over = validator.checkCapacity(calendar, d("2025-03-05"), meetings, events, limits(2, 3, 4, 100), 20);
        assertThat(over.messages()).containsExactly("daily request load exceeded: 110/100");
    }

    @Test
    void everyRuleIsReported() {
        var meetings = List.of(meeting(1L, 10L, DIVISION, "2025-03-05"));
        var events = List.of(event(100L, 1L, 5L, 100));

        Decision decision = validator.checkCapacity(calendar, d("2025-03-05"), meetings, events, limits(1, 1, 1, 100), 1);

        assertThat(decision.messages()).containsExactly(
                "daily meeting cap exceeded: 1/1",
                "weekly meeting cap exceeded: 1/1",
                "daily request load exceeded: 101/100");
    }

    @Test
    void repeatedChecks_giveSameDecision() {
        ConfigurationSnapshot s = snapshot().meetings(List.of(meeting(1L, 10L, DIVISION, "2025-03-05"))).build();

        assertThat(validator.checkCapacity(s, d("2025-03-05"), 0)).isEqualTo(validator.checkCapacity(s, d("2025-03-05"), 0));
    }
}
