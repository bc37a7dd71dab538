package io.github.riemr.committee.exception;

public class InvalidRouteConfigException extends SchedulingException {
    public InvalidRouteConfigException(Long routeId, String detail) {
        super(SchedulingErrorKind.INVALID_ROUTE_CONFIG, "Invalid route " + routeId + ": " + detail);
    }
}
