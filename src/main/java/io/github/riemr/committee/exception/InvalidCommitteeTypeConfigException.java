package io.github.riemr.committee.exception;

public class InvalidCommitteeTypeConfigException extends SchedulingException {
    public InvalidCommitteeTypeConfigException(Long committeeTypeId, String detail) {
        super(SchedulingErrorKind.INVALID_COMMITTEE_TYPE_CONFIG, "Invalid committee type " + committeeTypeId + ": " + detail);
    }
}
