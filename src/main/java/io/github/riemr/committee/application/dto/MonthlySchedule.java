package io.github.riemr.committee.application.dto;

import java.time.YearMonth;
import java.util.List;

public record MonthlySchedule(YearMonth month, List<MeetingSuggestion> suggestions) {
    public MonthlySchedule {
        suggestions = List.copyOf(suggestions);
    }
}
