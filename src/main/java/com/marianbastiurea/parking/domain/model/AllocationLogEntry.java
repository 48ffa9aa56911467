package com.marianbastiurea.parking.domain.model;

import com.marianbastiurea.parking.domain.enums.Ledger;

import java.time.Instant;

/**
 * One processing-log row. Bay, slot and score are null for failed attempts.
 * Vehicle id and reason are cut to the width of their columns.
 */
public record AllocationLogEntry(
        Long id,
        Ledger ledger,
        String vehicleId,
        String status,
        Integer bay,
        Integer slot,
        Double score,
        String reason,
        Instant loggedAt
) {
    public static final int REASON_WIDTH = 255;

    public static AllocationLogEntry of(Ledger ledger, AllocationOutcome outcome, Instant at) {
        AllocationDecision d = outcome.decision();
        boolean ok = outcome.success();
        return new AllocationLogEntry(
                null,
                ledger,
                clip(outcome.vehicleId(), VehicleRequest.MAX_VEHICLE_ID_LENGTH),
                ok ? "ALLOCATED" : (d != null ? "REJECTED" : "FAILED"),
                ok ? d.bayAssigned() : null,
                ok ? d.slotAssigned() : null,
                ok ? d.score() : null,
                ok ? "ALLOCATE" : clip(outcome.errorMessage(), REASON_WIDTH),
                at
        );
    }

    private static String clip(String value, int width) {
        return value == null || value.length() <= width ? value : value.substring(0, width);
    }
}
