package io.github.riemr.committee.infrastructure.repository;

import io.github.riemr.committee.application.repository.ExceptionDateRepository;
import io.github.riemr.committee.infrastructure.mapper.ExceptionDateMapper;
import io.github.riemr.committee.infrastructure.persistence.entity.ExceptionDateMaster;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public class ExceptionDateRepositoryImpl implements ExceptionDateRepository {
    private final ExceptionDateMapper mapper;
    public ExceptionDateRepositoryImpl(ExceptionDateMapper mapper) { this.mapper = mapper; }
    @Override public List<ExceptionDateMaster> listActiveBetween(LocalDate from, LocalDate to) { return mapper.selectActiveBetween(from, to); }
}
