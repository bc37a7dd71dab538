package io.github.riemr.committee.infrastructure.repository;

import io.github.riemr.committee.application.repository.VaadaRepository;
import io.github.riemr.committee.infrastructure.mapper.VaadaMapper;
import io.github.riemr.committee.infrastructure.persistence.entity.Vaada;
import io.github.riemr.committee.infrastructure.persistence.entity.VaadaEvent;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public class VaadaRepositoryImpl implements VaadaRepository {
    private final VaadaMapper mapper;
    public VaadaRepositoryImpl(VaadaMapper mapper) { this.mapper = mapper; }
    @Override public List<Vaada> listBetween(LocalDate from, LocalDate to) { return mapper.selectNotDeletedBetween(from, to); }

    @Override
    public List<VaadaEvent> listEvents(Collection<Long> vaadaIds) {
        // empty IN () is invalid SQL
        if (vaadaIds == null || vaadaIds.isEmpty()) return List.of();
        return mapper.selectEventsByVaadaIds(vaadaIds);
    }
}
