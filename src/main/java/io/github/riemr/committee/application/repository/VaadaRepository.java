package io.github.riemr.committee.application.repository;

import io.github.riemr.committee.infrastructure.persistence.entity.Vaada;
import io.github.riemr.committee.infrastructure.persistence.entity.VaadaEvent;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface VaadaRepository {
    List<Vaada> listBetween(LocalDate from, LocalDate to);
    List<VaadaEvent> listEvents(Collection<Long> vaadaIds);
}
