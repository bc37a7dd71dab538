package io.github.riemr.committee.util;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Weekday ordinals used throughout the scheduler: 0 = Sunday ... 6 = Saturday.
 */
public final class Weekdays {
    public static final int SUNDAY = 0;
    public static final int MONDAY = 1;
    public static final int TUESDAY = 2;
    public static final int WEDNESDAY = 3;
    public static final int THURSDAY = 4;
    public static final int FRIDAY = 5;
    public static final int SATURDAY = 6;

    private static final String[] NAMES = {"Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"};

    private Weekdays() {
    }

    public static int ordinalOf(DayOfWeek dow) {
        return dow.getValue() % 7;
    }

    public static int ordinalOf(LocalDate date) {
        return ordinalOf(date.getDayOfWeek());
    }

    public static boolean isValid(Integer ordinal) {
        return ordinal != null && ordinal >= SUNDAY && ordinal <= SATURDAY;
    }

    public static int requireValid(int ordinal) {
        if (!isValid(ordinal)) throw new IllegalArgumentException("weekday must be 0..6: " + ordinal);
        return ordinal;
    }

    public static String nameOf(int ordinal) {
        return NAMES[requireValid(ordinal)];
    }

    /** Parses "0,1,2,3,4" into a sorted set; returns null when any token is malformed. */
    public static Set<Integer> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) return null;
        Set<Integer> days = new TreeSet<>();
        for (String token : csv.split(",")) {
            String t = token.trim();
            if (t.isEmpty()) continue;
            try {
                int v = Integer.parseInt(t);
                if (!isValid(v)) return null;
                days.add(v);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return days;
    }

    public static String toCsv(Collection<Integer> days) {
        return new TreeSet<>(days).stream().map(String::valueOf).reduce((a, b) -> a + "," + b).orElse("");
    }

    /** Occurrence of the date's weekday within its month, 1..5. */
    public static int occurrenceInMonth(LocalDate date) {
        return (date.getDayOfMonth() - 1) / 7 + 1;
    }
}
