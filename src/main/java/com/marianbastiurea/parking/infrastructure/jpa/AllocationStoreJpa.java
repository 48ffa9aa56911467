package com.marianbastiurea.parking.infrastructure.jpa;

import com.marianbastiurea.parking.domain.enums.Ledger;
import com.marianbastiurea.parking.domain.errors.AllocationNotFoundException;
import com.marianbastiurea.parking.domain.model.AllocationFilter;
import com.marianbastiurea.parking.domain.model.AllocationPatch;
import com.marianbastiurea.parking.domain.model.AllocationRecord;
import com.marianbastiurea.parking.domain.repo.AllocationStore;
import com.marianbastiurea.parking.domain.repository.AllocationJpaRepository;
import com.marianbastiurea.parking.persistence.sql.AllocationEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
public class AllocationStoreJpa implements AllocationStore {

    private static final Logger log = LoggerFactory.getLogger(AllocationStoreJpa.class);

    private final AllocationJpaRepository repo;

    public AllocationStoreJpa(AllocationJpaRepository repo) {
        this.repo = repo;
    }

    @Override
    @Transactional
    public long create(AllocationRecord record) {
        Objects.requireNonNull(record, "record");
        AllocationEntity saved = repo.save(AllocationEntity.of(record));
        log.debug("[allocations.create] id={} ledger={} vehicle={} cell=({},{})",
                saved.getId(), record.ledger(), record.vehicleId(), record.bayAssigned(), record.slotAssigned());
        return saved.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AllocationRecord> get(long id) {
        return repo.findById(id).map(AllocationEntity::toDomain);
    }

    @Override
    @Transactional
    public AllocationRecord update(long id, AllocationPatch patch) {
        Objects.requireNonNull(patch, "patch");
        AllocationEntity e = repo.findById(id).orElseThrow(() -> new AllocationNotFoundException(id));
        if (patch.departureTime() != null) e.setDepartureTime(patch.departureTime());
        if (patch.priorityLevel() != null) e.setPriorityLevel(patch.priorityLevel());
        if (patch.active() != null) e.setActive(patch.active());
        AllocationEntity saved = repo.save(e);
        log.debug("[allocations.update] id={} patch={}", id, patch);
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AllocationRecord> list(AllocationFilter filter) {
        Objects.requireNonNull(filter, "filter");
        List<AllocationEntity> rows = filter.activeOnly()
                ? repo.findByLedgerAndActiveTrueOrderByIdAsc(filter.ledger())
                : repo.findByLedgerOrderByIdAsc(filter.ledger());
        return rows.stream()
                .map(AllocationEntity::toDomain)
                .filter(filter::matches)
                .toList();
    }

    @Override
    @Transactional
    public int clear(Ledger ledger) {
        long removed = repo.deleteByLedger(ledger);
        log.info("[allocations.clear] ledger={} removed={}", ledger, removed);
        return (int) removed;
    }
}
