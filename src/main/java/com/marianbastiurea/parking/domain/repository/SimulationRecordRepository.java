package com.marianbastiurea.parking.domain.repository;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.model.SimulationRecord;

import java.util.List;

public interface SimulationRecordRepository {

    String save(SimulationRecord record);

    /** Most recent runs of one strategy first. */
    List<SimulationRecord> recent(PolicyKind strategy, int limit);
}
