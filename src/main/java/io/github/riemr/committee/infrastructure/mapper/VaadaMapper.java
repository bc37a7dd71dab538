package io.github.riemr.committee.infrastructure.mapper;

import io.github.riemr.committee.infrastructure.persistence.entity.Vaada;
import io.github.riemr.committee.infrastructure.persistence.entity.VaadaEvent;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Mapper
public interface VaadaMapper {
    List<Vaada> selectNotDeletedBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);
    List<VaadaEvent> selectEventsByVaadaIds(@Param("vaadaIds") Collection<Long> vaadaIds);
}
