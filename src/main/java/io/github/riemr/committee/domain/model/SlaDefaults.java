package io.github.riemr.committee.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Route SLA values used when a route leaves them unset, plus the lead time for SLA milestones.
 */
@Value
@Builder
public class SlaDefaults {
    @Builder.Default
    int totalSlaDays = 45;
    @Builder.Default
    int stageADays = 10;
    @Builder.Default
    int stageBDays = 15;
    @Builder.Default
    int stageCDays = 10;
    @Builder.Default
    int stageDDays = 10;
    @Builder.Default
    int slaDaysBefore = 14;

    public static SlaDefaults standard() {
        return SlaDefaults.builder().build();
    }
}
