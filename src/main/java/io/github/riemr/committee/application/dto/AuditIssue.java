package io.github.riemr.committee.application.dto;

import java.time.LocalDate;

public record AuditIssue(LocalDate date, ViolationType type, String message) {
}
