package io.github.riemr.committee.application.repository;

import io.github.riemr.committee.infrastructure.persistence.entity.ExceptionDateMaster;

import java.time.LocalDate;
import java.util.List;

public interface ExceptionDateRepository {
    List<ExceptionDateMaster> listActiveBetween(LocalDate from, LocalDate to);
}
