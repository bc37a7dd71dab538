package io.github.riemr.committee.application.dto;

import java.time.LocalDate;
import java.util.List;

public record Candidate(LocalDate date, boolean available, List<String> reasons) {
    public Candidate {
        reasons = List.copyOf(reasons);
    }
}
