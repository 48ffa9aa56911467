package com.marianbastiurea.parking.domain.repo;

import com.marianbastiurea.parking.domain.enums.Ledger;
import com.marianbastiurea.parking.domain.model.AllocationLogEntry;

import java.util.List;

public interface AllocationLogRepo {

    void insert(AllocationLogEntry entry);

    /** Most recent entries first. */
    List<AllocationLogEntry> findRecent(Ledger ledger, int limit);
}
