package io.github.riemr.committee.application.dto;

import java.time.LocalDate;

public record MeetingProposal(Long committeeTypeId, Long divisionId, LocalDate date) {
}
