package io.github.riemr.committee.application.dto;

import java.util.List;

public record RejectedSuggestion(MeetingSuggestion suggestion, List<String> reasons) {
}
