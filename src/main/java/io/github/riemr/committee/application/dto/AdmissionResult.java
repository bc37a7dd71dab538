package io.github.riemr.committee.application.dto;

import lombok.Value;

import java.util.List;

@Value
public class AdmissionResult {
    boolean admitted;
    /** True when admission needed the override flag to pass a blocking policy. */
    boolean overridden;
    Decision decision;

    public List<String> warnings() {
        return decision.messages();
    }
}
