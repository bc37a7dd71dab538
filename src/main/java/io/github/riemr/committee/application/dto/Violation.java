package io.github.riemr.committee.application.dto;

public record Violation(ViolationType type, String message) {
}
