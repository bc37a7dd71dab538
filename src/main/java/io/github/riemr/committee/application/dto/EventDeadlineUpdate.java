package io.github.riemr.committee.application.dto;

import io.github.riemr.committee.domain.model.Event;

public record EventDeadlineUpdate(Event previous, Event updated) {
}
