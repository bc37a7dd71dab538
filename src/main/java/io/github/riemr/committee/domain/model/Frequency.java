package io.github.riemr.committee.domain.model;

public enum Frequency {
    WEEKLY,
    MONTHLY;

    public static Frequency fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return Frequency.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
