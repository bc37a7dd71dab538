package io.github.riemr.committee.infrastructure.repository;

import io.github.riemr.committee.application.repository.MasterDataRepository;
import io.github.riemr.committee.infrastructure.mapper.CommitteeTypeMapper;
import io.github.riemr.committee.infrastructure.mapper.HativaMapper;
import io.github.riemr.committee.infrastructure.mapper.MaslulMapper;
import io.github.riemr.committee.infrastructure.persistence.entity.CommitteeTypeMaster;
import io.github.riemr.committee.infrastructure.persistence.entity.HativaDay;
import io.github.riemr.committee.infrastructure.persistence.entity.HativaMaster;
import io.github.riemr.committee.infrastructure.persistence.entity.MaslulMaster;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class MasterDataRepositoryImpl implements MasterDataRepository {
    private final HativaMapper hativaMapper;
    private final MaslulMapper maslulMapper;
    private final CommitteeTypeMapper committeeTypeMapper;

    public MasterDataRepositoryImpl(HativaMapper hativaMapper, MaslulMapper maslulMapper, CommitteeTypeMapper committeeTypeMapper) {
        this.hativaMapper = hativaMapper;
        this.maslulMapper = maslulMapper;
        this.committeeTypeMapper = committeeTypeMapper;
    }

    @Override public List<HativaMaster> listHativot() { return hativaMapper.selectAll(); }
    @Override public List<HativaDay> listHativaDays() { return hativaMapper.selectAllDays(); }
    @Override public List<MaslulMaster> listMaslulim() { return maslulMapper.selectAll(); }
    @Override public List<CommitteeTypeMaster> listCommitteeTypes() { return committeeTypeMapper.selectAll(); }
}
