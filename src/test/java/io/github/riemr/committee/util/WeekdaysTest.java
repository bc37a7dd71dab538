package io.github.riemr.committee.util;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeekdaysTest {

    @Test
    void ordinals_startAtSunday() {
        assertThat(Weekdays.ordinalOf(DayOfWeek.SUNDAY)).isZero();
        assertThat(Weekdays.ordinalOf(LocalDate.of(2025, 3, 8))).isEqualTo(Weekdays.SATURDAY);
        assertThat(Weekdays.nameOf(2)).isEqualTo("Tuesday");
        assertThatThrownBy(() -> Weekdays.nameOf(7)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseCsv_rejectsMalformedInput() {
        assertThat(Weekdays.parseCsv("4, 0,1,,2")).containsExactly(0, 1, 2, 4);
        assertThat(Weekdays.parseCsv("0,x")).isNull();
        assertThat(Weekdays.parseCsv("0,9")).isNull();
        assertThat(Weekdays.parseCsv("")).isNull();
        assertThat(Weekdays.toCsv(List.of(3, 1, 0))).isEqualTo("0,1,3");
    }

    @Test
    void occurrenceInMonth_countsFromFirstDay() {
        assertThat(Weekdays.occurrenceInMonth(LocalDate.of(2025, 3, 7))).isEqualTo(1);
        assertThat(Weekdays.occurrenceInMonth(LocalDate.of(2025, 3, 15))).isEqualTo(3);
        assertThat(Weekdays.occurrenceInMonth(LocalDate.of(2025, 3, 31))).isEqualTo(5);
    }
}
