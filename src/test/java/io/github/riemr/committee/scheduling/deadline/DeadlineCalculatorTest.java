package io.github.riemr.committee.scheduling.deadline;

import io.github.riemr.committee.application.dto.SlaMilestones;
import io.github.riemr.committee.application.dto.StageDeadlines;
import io.github.riemr.committee.domain.model.Route;
import io.github.riemr.committee.domain.model.SlaDefaults;
import io.github.riemr.committee.exception.DateOrderingViolationException;
import io.github.riemr.committee.exception.InvalidRouteConfigException;
import io.github.riemr.committee.exception.SchedulingErrorKind;
import io.github.riemr.committee.scheduling.calendar.BusinessCalendar;
import org.junit.jupiter.api.Test;

import static io.github.riemr.committee.scheduling.SchedulingFixtures.d;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.holiday;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.route;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.sunToThu;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadlineCalculatorTest {

    private final DeadlineCalculator calculator = new DeadlineCalculator();
    private final BusinessCalendar calendar = BusinessCalendar.of(sunToThu());

    @Test
    void stageChain_backCalculatedFromThursdayMeeting() {
        StageDeadlines s = calculator.computeStageDeadlines(calendar, d("2025-06-12"), route(5L, 1L), null, SlaDefaults.standard());

        assertThat(s.getCallStart()).isEqualTo(d("2025-04-10"));
        assertThat(calendar.businessDaysBetween(s.getCallStart(), s.getMeetingDate())).isEqualTo(45);
        assertThat(s.getCallDeadline()).isEqualTo(d("2025-04-24"));
        assertThat(s.getIntakeDeadline()).isEqualTo(d("2025-05-15"));
        assertThat(s.getReviewDeadline()).isEqualTo(d("2025-05-29"));
        assertThat(s.getReviewDeadline()).isBefore(s.getMeetingDate());
        assertThat(s.getResponseDeadline()).isEqualTo(d("2025-06-26"));
    }

    @Test
    void exceptionDate_pushesCallStartEarlier() {
        BusinessCalendar withHoliday = BusinessCalendar.of(sunToThu(holiday(1L, "2025-05-01", "Memorial Day")));

        StageDeadlines s = calculator.computeStageDeadlines(withHoliday, d("2025-06-12"), route(5L, 1L), null, SlaDefaults.standard());

        assertThat(s.getCallStart()).isEqualTo(d("2025-04-09"));
        assertThat(s.getCallDeadline()).isEqualTo(d("2025-04-23"));
        assertThat(s.getIntakeDeadline()).isEqualTo(d("2025-05-15"));
    }

    @Test
    void missingRouteValues_fallBackToDefaults() {
        Route bare = Route.builder().id(7L).divisionId(1L).name("bare").build();

        StageDeadlines s = calculator.computeStageDeadlines(calendar, d("2025-06-12"), bare, null, SlaDefaults.standard());

        assertThat(s).isEqualTo(calculator.computeStageDeadlines(calendar, d("2025-06-12"), route(5L, 1L), null, null));
    }

    @Test
    void callPublicationDate_anchorsChain() {
        StageDeadlines s = calculator.computeStageDeadlines(calendar, d("2025-06-12"), route(5L, 1L), d("2025-04-01"), SlaDefaults.standard());

        assertThat(s.getCallStart()).isEqualTo(d("2025-04-01"));
        assertThat(s.getCallDeadline()).isEqualTo(calendar.stepBusinessDays(d("2025-04-01"), 10));
        assertThat(s.getCallDeadline()).isBeforeOrEqualTo(s.getIntakeDeadline());
        assertThat(s.getIntakeDeadline()).isBeforeOrEqualTo(s.getReviewDeadline());
        assertThat(s.getReviewDeadline()).isBeforeOrEqualTo(s.getMeetingDate());
        assertThat(s.getMeetingDate()).isBeforeOrEqualTo(s.getResponseDeadline());
    }

    @Test
    void totalShorterThanStages_isInvalidRoute() {
        Route r = route(5L, 1L).toBuilder().totalSlaDays(30).build();

        assertThatThrownBy(() -> calculator.computeStageDeadlines(calendar, d("2025-06-12"), r, null, SlaDefaults.standard()))
                .isInstanceOf(InvalidRouteConfigException.class)
                .hasMessageContaining("shorter than stages A+B+C");
    }

    @Test
    void negativeStage_isInvalidRoute() {
        Route r = route(5L, 1L).toBuilder().stageBDays(-1).build();

        assertThatThrownBy(() -> calculator.computeStageDeadlines(calendar, d("2025-06-12"), r, null, SlaDefaults.standard()))
                .isInstanceOfSatisfying(InvalidRouteConfigException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SchedulingErrorKind.INVALID_ROUTE_CONFIG));
    }

    @Test
    void publicationAfterMeeting_isOrderingViolation() {
        assertThatThrownBy(() -> calculator.computeStageDeadlines(calendar, d("2025-06-12"), route(5L, 1L), d("2025-06-15"), SlaDefaults.standard()))
                .isInstanceOf(DateOrderingViolationException.class);
    }

    @Test
    void chainOverrunningMeeting_isOrderingViolation() {
        assertThatThrownBy(() -> calculator.computeStageDeadlines(calendar, d("2025-06-12"), route(5L, 1L), d("2025-06-01"), SlaDefaults.standard()))
                .isInstanceOf(DateOrderingViolationException.class)
                .hasMessageContaining("falls after meeting");
    }

    @Test
    void slaMilestones_countBusinessDays() {
        SlaMilestones m = calculator.computeSlaMilestones(calendar, d("2025-06-12"), d("2025-06-08"), SlaDefaults.standard());

        assertThat(m.getRequestDeadline()).isEqualTo(d("2025-05-25"));
        assertThat(m.getPreparationStart()).isEqualTo(d("2025-05-14"));
        assertThat(m.getNotificationDate()).isEqualTo(d("2025-05-05"));
        assertThat(m.getBusinessDaysUntilMeeting()).isEqualTo(5);
    }

    @Test
    void slaMilestones_requireReferenceDate() {
        assertThatThrownBy(() -> calculator.computeSlaMilestones(calendar, d("2025-06-12"), null, SlaDefaults.standard()))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("referenceDate");
    }
}
