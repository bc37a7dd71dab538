package io.github.riemr.committee.infrastructure.mapper;

import io.github.riemr.committee.infrastructure.persistence.entity.HativaDay;
import io.github.riemr.committee.infrastructure.persistence.entity.HativaMaster;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface HativaMapper {
    List<HativaMaster> selectAll();
    List<HativaDay> selectAllDays();
}
