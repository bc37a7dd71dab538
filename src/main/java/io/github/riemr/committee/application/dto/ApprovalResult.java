package io.github.riemr.committee.application.dto;

import io.github.riemr.committee.domain.model.CommitteeMeeting;

import java.util.List;

public record ApprovalResult(List<CommitteeMeeting> approved, List<RejectedSuggestion> rejected) {
    public ApprovalResult {
        approved = List.copyOf(approved);
        rejected = List.copyOf(rejected);
    }
}
