package io.github.riemr.committee.domain.model;

/**
 * Why a calendar date is closed for business. Stored as a lower-case code.
 */
public enum ExceptionDateKind {
    HOLIDAY,
    SABBATICAL,
    HALF_DAY,
    CLOSURE,
    OTHER;

    public static ExceptionDateKind normalize(String code) {
        if (code == null || code.isBlank()) return HOLIDAY;
        String upper = code.trim().toUpperCase().replace('-', '_');
        for (ExceptionDateKind kind : values()) {
            if (kind.name().equals(upper)) return kind;
        }
        return OTHER;
    }

    public String code() {
        return name().toLowerCase();
    }
}
