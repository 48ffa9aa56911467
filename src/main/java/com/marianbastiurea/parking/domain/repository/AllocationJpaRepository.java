package com.marianbastiurea.parking.domain.repository;

import com.marianbastiurea.parking.domain.enums.Ledger;
import com.marianbastiurea.parking.persistence.sql.AllocationEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AllocationJpaRepository extends JpaRepository<AllocationEntity, Long> {

    List<AllocationEntity> findByLedgerOrderByIdAsc(Ledger ledger);

    List<AllocationEntity> findByLedgerAndActiveTrueOrderByIdAsc(Ledger ledger);

    long deleteByLedger(Ledger ledger);
}
