package io.github.riemr.committee.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A calendar date closed for business regardless of its weekday (holiday, closure, ...).
 */
@Value
@Builder
public class ExceptionDate {
    Long id;
    LocalDate date;
    String description;
    @Builder.Default
    ExceptionDateKind kind = ExceptionDateKind.HOLIDAY;
}
