package io.github.riemr.committee.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a committee meeting. Meetings are never deleted; they end as COMPLETED or CANCELLED.
 */
public enum MeetingStatus {
    PLANNED,
    SCHEDULED,
    COMPLETED,
    CANCELLED;

    public Set<MeetingStatus> nextStates() {
        switch (this) {
            case PLANNED:
                return EnumSet.of(SCHEDULED, CANCELLED);
            case SCHEDULED:
                return EnumSet.of(COMPLETED, CANCELLED);
            default:
                return EnumSet.noneOf(MeetingStatus.class);
        }
    }

    public boolean canTransitionTo(MeetingStatus target) {
        return target != null && nextStates().contains(target);
    }

    public boolean isTerminal() {
        return nextStates().isEmpty();
    }

    /** Cancelled meetings do not occupy capacity or slots. */
    public boolean isActive() {
        return this != CANCELLED;
    }

    public static MeetingStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return MeetingStatus.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
