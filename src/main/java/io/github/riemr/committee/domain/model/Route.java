package io.github.riemr.committee.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Funding track (maslul) with its SLA configuration. Stage durations are business-day counts.
 * <ul>
 *   <li>A: call publication window</li>
 *   <li>B: intake window</li>
 *   <li>C: review window</li>
 *   <li>D: response window after the meeting</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class Route {
    Long id;
    Long divisionId;
    String name;
    @Builder.Default
    boolean active = true;
    Integer totalSlaDays;
    Integer stageADays;
    Integer stageBDays;
    Integer stageCDays;
    Integer stageDDays;
}
