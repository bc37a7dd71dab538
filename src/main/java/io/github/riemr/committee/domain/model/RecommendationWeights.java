package io.github.riemr.committee.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Bonuses and penalties for ranking existing meetings as a home for a new event.
 */
@Value
@Builder
public class RecommendationWeights {
    @Builder.Default int baseScore = 100;
    @Builder.Default int bestBonus = 25;
    @Builder.Default int spaceBonus = 10;
    @Builder.Default int slaBonus = 20;
    @Builder.Default int optimalRangeBonus = 15;
    @Builder.Default int noEventsBonus = 5;
    @Builder.Default int highLoadPenalty = 15;
    @Builder.Default int mediumLoadPenalty = 5;
    @Builder.Default int noSpacePenalty = 50;
    @Builder.Default int noSlaPenalty = 30;
    @Builder.Default int tightSlaPenalty = 10;
    @Builder.Default int farFuturePenalty = 10;
    @Builder.Default int weekFullPenalty = 20;
    @Builder.Default int optimalRangeStart = 0;
    @Builder.Default int optimalRangeEnd = 30;
    @Builder.Default int farFutureThreshold = 60;

    public static RecommendationWeights defaults() {
        return RecommendationWeights.builder().build();
    }
}
