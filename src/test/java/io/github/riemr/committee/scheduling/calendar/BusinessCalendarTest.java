package io.github.riemr.committee.scheduling.calendar;

import io.github.riemr.committee.domain.model.WorkCalendar;
import io.github.riemr.committee.exception.EmptyCalendarConfigException;
import io.github.riemr.committee.exception.InvalidSearchWindowException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static io.github.riemr.committee.scheduling.SchedulingFixtures.d;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.holiday;
import static io.github.riemr.committee.scheduling.SchedulingFixtures.sunToThu;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BusinessCalendarTest {

    private final BusinessCalendar calendar = BusinessCalendar.of(sunToThu(holiday(1L, "2025-05-01", "Memorial Day")));

    @Test
    void isBusinessDay_falseOnWeekendAndExceptionDates() {
        assertThat(calendar.isBusinessDay(d("2025-03-05"))).isTrue();   // Wed
        assertThat(calendar.isBusinessDay(d("2025-03-07"))).isFalse();  // Fri
        assertThat(calendar.isBusinessDay(d("2025-03-08"))).isFalse();  // Sat
        assertThat(calendar.isBusinessDay(d("2025-05-01"))).isFalse();  // Thu, exception
        assertThat(calendar.exceptionOn(d("2025-05-01"))).get()
                .extracting(e -> e.getDescription()).isEqualTo("Memorial Day");
    }

    @Test
    void stepBusinessDays_skipsWeekendAndNeverCountsStart() {
        assertThat(calendar.stepBusinessDays(d("2025-03-06"), 1)).isEqualTo(d("2025-03-09"));
        assertThat(calendar.stepBusinessDays(d("2025-03-09"), -1)).isEqualTo(d("2025-03-06"));
        assertThat(calendar.stepBusinessDays(d("2025-04-30"), 1)).isEqualTo(d("2025-05-04"));
    }

    @Test
    void stepBusinessDays_zeroRollsForwardToBusinessDay() {
        assertThat(calendar.stepBusinessDays(d("2025-03-07"), 0)).isEqualTo(d("2025-03-09"));
        assertThat(calendar.stepBusinessDays(d("2025-03-05"), 0)).isEqualTo(d("2025-03-05"));
    }

    @Test
    void stepBusinessDays_roundTripsFromBusinessDay() {
        LocalDate start = d("2025-04-24");
        for (int n = -40; n <= 40; n++) {
            LocalDate there = calendar.stepBusinessDays(start, n);
            assertThat(calendar.stepBusinessDays(there, -n)).as("n=%d", n).isEqualTo(start);
        }
    }

    @Test
    void businessDays_countsAndLists() {
        // Sun 2 .. Thu 6 March
        assertThat(calendar.businessDaysBetween(d("2025-03-02"), d("2025-03-09"))).isEqualTo(5);
        assertThat(calendar.businessDaysBetween(d("2025-03-09"), d("2025-03-02"))).isEqualTo(-5);
        assertThat(calendar.businessDaysIn(d("2025-03-05"), d("2025-03-09")))
                .containsExactly(d("2025-03-05"), d("2025-03-06"), d("2025-03-09"));
        assertThatThrownBy(() -> calendar.businessDaysIn(d("2025-03-09"), d("2025-03-05")))
                .isInstanceOf(InvalidSearchWindowException.class);
    }

    @Test
    void weekBounds_followWorkWeek() {
        assertThat(calendar.getWeekStartOrdinal()).isZero();
        assertThat(calendar.weekStart(d("2025-03-05"))).isEqualTo(d("2025-03-02"));
        assertThat(calendar.weekEnd(d("2025-03-05"))).isEqualTo(d("2025-03-08"));

        BusinessCalendar monToFri = BusinessCalendar.of(WorkCalendar.of(List.of(1, 2, 3, 4, 5), List.of()));
        assertThat(monToFri.weekStart(d("2025-03-05"))).isEqualTo(d("2025-03-03"));
        assertThat(monToFri.weekStart(d("2025-03-09"))).isEqualTo(d("2025-03-03"));

        BusinessCalendar everyDay = BusinessCalendar.of(WorkCalendar.of(List.of(0, 1, 2, 3, 4, 5, 6), List.of()));
        assertThat(everyDay.getWeekStartOrdinal()).isZero();
    }

    @Test
    void closedReason_namesExceptionOrWeekday() {
        assertThat(calendar.closedReason(d("2025-05-01"))).contains("falls on exception date: Memorial Day");
        assertThat(calendar.closedReason(d("2025-03-07"))).contains("not a working weekday");
        assertThat(calendar.closedReason(d("2025-03-05"))).isEmpty();
    }

    @Test
    void thirdWeek_isDays15To21() {
        assertThat(BusinessCalendar.isThirdWeek(d("2025-03-14"))).isFalse();
        assertThat(BusinessCalendar.isThirdWeek(d("2025-03-15"))).isTrue();
        assertThat(BusinessCalendar.isThirdWeek(d("2025-03-21"))).isTrue();
        assertThat(BusinessCalendar.isThirdWeek(d("2025-03-22"))).isFalse();
    }

    @Test
    void emptyWorkWeek_isRejected() {
        assertThatThrownBy(() -> BusinessCalendar.of(WorkCalendar.of(List.of(), List.of())))
                .isInstanceOf(EmptyCalendarConfigException.class);
    }

    @Test
    void stepBusinessDays_rejectsUnrepresentableStep() {
        assertThatThrownBy(() -> calendar.stepBusinessDays(d("2025-03-05"), Integer.MIN_VALUE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
