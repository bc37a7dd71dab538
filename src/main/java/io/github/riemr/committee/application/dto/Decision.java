package io.github.riemr.committee.application.dto;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Value
public class Decision {
    boolean ok;
    List<Violation> violations;
    CapacityCounts counts;

    public static Decision of(List<Violation> violations, CapacityCounts counts) {
        List<Violation> copy = List.copyOf(violations);
        return new Decision(copy.isEmpty(), copy, counts);
    }

    public List<String> messages() {
        return violations.stream().map(Violation::message).collect(Collectors.toList());
    }

    public boolean has(ViolationType type) {
        return violations.stream().anyMatch(v -> v.type() == type);
    }

    /** Same counts, with the given violations placed before the capacity ones. */
    public Decision withLeading(List<Violation> leading) {
        List<Violation> all = new ArrayList<>(leading);
        all.addAll(violations);
        return of(all, counts);
    }
}
