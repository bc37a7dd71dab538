package io.github.riemr.committee.exception;

/**
 * Base type for input the engine refuses to compute on. Capacity problems are never reported this way.
 */
public abstract class SchedulingException extends RuntimeException {
    private final SchedulingErrorKind kind;

    protected SchedulingException(SchedulingErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SchedulingErrorKind getKind() {
        return kind;
    }
}
