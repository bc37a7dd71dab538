package io.github.riemr.committee.scheduling.calendar;

import io.github.riemr.committee.domain.model.ExceptionDate;
import io.github.riemr.committee.domain.model.WorkCalendar;
import io.github.riemr.committee.exception.EmptyCalendarConfigException;
import io.github.riemr.committee.exception.InvalidSearchWindowException;
import io.github.riemr.committee.util.Weekdays;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Business-day arithmetic over a {@link WorkCalendar}. A business day is a working weekday that is not an
 * exception date.
 */
public final class BusinessCalendar {
    private final WorkCalendar workCalendar;
    private final int weekStartOrdinal;

    private BusinessCalendar(WorkCalendar workCalendar) {
        this.workCalendar = workCalendar;
        this.weekStartOrdinal = deriveWeekStart(workCalendar);
    }

    public static BusinessCalendar of(WorkCalendar workCalendar) {
        if (workCalendar == null || workCalendar.getWorkWeekdays().isEmpty()) {
            throw new EmptyCalendarConfigException();
        }
        return new BusinessCalendar(workCalendar);
    }

    public WorkCalendar getWorkCalendar() {
        return workCalendar;
    }

    public boolean isBusinessDay(LocalDate date) {
        return workCalendar.isWorkWeekday(Weekdays.ordinalOf(date)) && workCalendar.exceptionOn(date).isEmpty();
    }

    public Optional<ExceptionDate> exceptionOn(LocalDate date) {
        return workCalendar.exceptionOn(date);
    }

    /** Why the date is not a business day, empty when it is one. */
    public Optional<String> closedReason(LocalDate date) {
        Optional<ExceptionDate> exception = workCalendar.exceptionOn(date);
        if (exception.isPresent()) {
            String description = exception.get().getDescription();
            return Optional.of("falls on exception date: " + (description == null ? date.toString() : description));
        }
        if (!workCalendar.isWorkWeekday(Weekdays.ordinalOf(date))) {
            return Optional.of("not a working weekday");
        }
        return Optional.empty();
    }

    /**
     * Moves {@code |n|} business days forward or backward. The start date never counts.
     * {@code n == 0} yields the nearest business day at or after {@code date}.
     */
    public LocalDate stepBusinessDays(LocalDate date, int n) {
        if (n == 0) {
            LocalDate d = date;
            while (!isBusinessDay(d)) d = d.plusDays(1);
            return d;
        }
        if (n == Integer.MIN_VALUE) {
            throw new IllegalArgumentException("business day step out of range: " + n);
        }
        int direction = n > 0 ? 1 : -1;
        int remaining = Math.abs(n);
        LocalDate d = date;
        while (remaining > 0) {
            d = d.plusDays(direction);
            if (isBusinessDay(d)) remaining--;
        }
        return d;
    }

    /** Business days in {@code [from, toExclusive)}; negative when the range is reversed. */
    public int businessDaysBetween(LocalDate from, LocalDate toExclusive) {
        if (toExclusive.isBefore(from)) {
            return -businessDaysBetween(toExclusive, from);
        }
        int count = 0;
        for (LocalDate d = from; d.isBefore(toExclusive); d = d.plusDays(1)) {
            if (isBusinessDay(d)) count++;
        }
        return count;
    }

    public List<LocalDate> businessDaysIn(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new InvalidSearchWindowException("range end " + to + " is before start " + from);
        }
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (isBusinessDay(d)) days.add(d);
        }
        return days;
    }

    public int getWeekStartOrdinal() {
        return weekStartOrdinal;
    }

    public LocalDate weekStart(LocalDate date) {
        int offset = (Weekdays.ordinalOf(date) - weekStartOrdinal + 7) % 7;
        return date.minusDays(offset);
    }

    public LocalDate weekEnd(LocalDate date) {
        return weekStart(date).plusDays(6);
    }

    /** Days 15..21 of the month. */
    public static boolean isThirdWeek(LocalDate date) {
        int day = date.getDayOfMonth();
        return day >= 15 && day <= 21;
    }

    // first working weekday whose predecessor is off; a seven-day week starts on Sunday
    private static int deriveWeekStart(WorkCalendar calendar) {
        for (int d = Weekdays.SUNDAY; d <= Weekdays.SATURDAY; d++) {
            int previous = (d + 6) % 7;
            if (calendar.isWorkWeekday(d) && !calendar.isWorkWeekday(previous)) {
                return d;
            }
        }
        return Weekdays.SUNDAY;
    }
}
