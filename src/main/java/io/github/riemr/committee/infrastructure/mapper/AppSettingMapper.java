package io.github.riemr.committee.infrastructure.mapper;

import io.github.riemr.committee.infrastructure.persistence.entity.AppSetting;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface AppSettingMapper {
    AppSetting selectByKey(@Param("key") String key);
    List<AppSetting> selectAll();
    int upsert(@Param("key") String key, @Param("value") String value);
}
