package io.github.riemr.committee.domain.model;

import io.github.riemr.committee.util.Weekdays;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Working weekdays plus the exception dates that close otherwise working days.
 */
@EqualsAndHashCode
@ToString
public final class WorkCalendar {
    private final Set<Integer> workWeekdays;
    private final Map<LocalDate, ExceptionDate> exceptions;

    private WorkCalendar(Set<Integer> workWeekdays, Map<LocalDate, ExceptionDate> exceptions) {
        this.workWeekdays = Collections.unmodifiableSet(workWeekdays);
        this.exceptions = Collections.unmodifiableMap(exceptions);
    }

    public static WorkCalendar of(Collection<Integer> workWeekdays, Collection<ExceptionDate> exceptionDates) {
        Objects.requireNonNull(workWeekdays, "workWeekdays");
        Set<Integer> days = new TreeSet<>();
        for (Integer d : workWeekdays) {
            if (!Weekdays.isValid(d)) throw new IllegalArgumentException("weekday must be 0..6: " + d);
            days.add(d);
        }
        Map<LocalDate, ExceptionDate> byDate = new TreeMap<>();
        if (exceptionDates != null) {
            for (ExceptionDate e : exceptionDates) {
                Objects.requireNonNull(e.getDate(), "exception date");
                if (byDate.putIfAbsent(e.getDate(), e) != null) {
                    throw new IllegalArgumentException("duplicate exception date: " + e.getDate());
                }
            }
        }
        return new WorkCalendar(days, byDate);
    }

    public Set<Integer> getWorkWeekdays() {
        return workWeekdays;
    }

    public boolean isWorkWeekday(int ordinal) {
        return workWeekdays.contains(ordinal);
    }

    public Optional<ExceptionDate> exceptionOn(LocalDate date) {
        return Optional.ofNullable(exceptions.get(date));
    }

    public List<ExceptionDate> getExceptionDates() {
        return new ArrayList<>(exceptions.values());
    }
}
