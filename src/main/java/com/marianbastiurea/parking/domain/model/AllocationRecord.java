package com.marianbastiurea.parking.domain.model;

import com.marianbastiurea.parking.domain.enums.Ledger;
import com.marianbastiurea.parking.domain.enums.PlateType;
import com.marianbastiurea.parking.domain.enums.VehicleClass;

import java.time.Instant;

/** Persisted allocation row. {@code id} is null until the store assigns one. */
public record AllocationRecord(
        Long id,
        Ledger ledger,
        String vehicleId,
        PlateType plateType,
        VehicleClass vehicleClass,
        int bayAssigned,
        int slotAssigned,
        double allocationScore,
        Instant allocationTime,
        Instant arrivalTime,
        Instant departureTime,
        int priorityLevel,
        boolean active
) {
    public static AllocationRecord of(Ledger ledger, VehicleRequest request, AllocationDecision decision) {
        return new AllocationRecord(
                null,
                ledger,
                request.vehicleId(),
                request.plateType(),
                request.vehicleClass(),
                decision.bayAssigned(),
                decision.slotAssigned(),
                decision.score(),
                decision.decisionTime(),
                request.arrivalTime().toInstant(),
                request.departureTime().toInstant(),
                request.priorityLevel(),
                true
        );
    }

    public Cell cell() {
        return Cell.ofNumbers(bayAssigned, slotAssigned);
    }

    public Reservation toReservation() {
        return new Reservation(vehicleId, arrivalTime, departureTime, priorityLevel);
    }

    public AllocationRecord withId(Long newId) {
        return new AllocationRecord(newId, ledger, vehicleId, plateType, vehicleClass, bayAssigned, slotAssigned,
                allocationScore, allocationTime, arrivalTime, departureTime, priorityLevel, active);
    }
}
