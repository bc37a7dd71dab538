package io.github.riemr.committee.infrastructure.mapper;

import io.github.riemr.committee.infrastructure.persistence.entity.ExceptionDateMaster;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface ExceptionDateMapper {
    List<ExceptionDateMaster> selectActiveBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
