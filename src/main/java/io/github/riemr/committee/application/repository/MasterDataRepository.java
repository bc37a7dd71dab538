package io.github.riemr.committee.application.repository;

import io.github.riemr.committee.infrastructure.persistence.entity.CommitteeTypeMaster;
import io.github.riemr.committee.infrastructure.persistence.entity.HativaDay;
import io.github.riemr.committee.infrastructure.persistence.entity.HativaMaster;
import io.github.riemr.committee.infrastructure.persistence.entity.MaslulMaster;

import java.util.List;

/** Divisions, routes and committee types. */
public interface MasterDataRepository {
    List<HativaMaster> listHativot();
    List<HativaDay> listHativaDays();
    List<MaslulMaster> listMaslulim();
    List<CommitteeTypeMaster> listCommitteeTypes();
}
