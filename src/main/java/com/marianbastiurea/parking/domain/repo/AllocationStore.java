package com.marianbastiurea.parking.domain.repo;

import com.marianbastiurea.parking.domain.enums.Ledger;
import com.marianbastiurea.parking.domain.model.AllocationFilter;
import com.marianbastiurea.parking.domain.model.AllocationPatch;
import com.marianbastiurea.parking.domain.model.AllocationRecord;

import java.util.List;
import java.util.Optional;

public interface AllocationStore {

    long create(AllocationRecord record);

    Optional<AllocationRecord> get(long id);

    /** @throws com.marianbastiurea.parking.domain.errors.AllocationNotFoundException if no record has this id */
    AllocationRecord update(long id, AllocationPatch patch);

    /** Matching records in creation order. */
    List<AllocationRecord> list(AllocationFilter filter);

    int clear(Ledger ledger);
}
