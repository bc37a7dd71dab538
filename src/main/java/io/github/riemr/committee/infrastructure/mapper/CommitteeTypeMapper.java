package io.github.riemr.committee.infrastructure.mapper;

import io.github.riemr.committee.infrastructure.persistence.entity.CommitteeTypeMaster;
import org.apache.ibatis.annotations.Mapper;

import java.util.List;

@Mapper
public interface CommitteeTypeMapper {
    List<CommitteeTypeMaster> selectAll();
}
