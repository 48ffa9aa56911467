package com.marianbastiurea.parking.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Per-request entry of a simulation run. {@code decision} is null when the
 * request failed before a decision was produced.
 */
public record AllocationOutcome(
        int index,
        String vehicleId,
        boolean success,
        AllocationDecision decision,
        String errorMessage
) {
    public static AllocationOutcome allocated(int index, String vehicleId, AllocationDecision decision) {
        return new AllocationOutcome(index, vehicleId, true, decision, null);
    }

    public static AllocationOutcome rejected(int index, String vehicleId, AllocationDecision decision) {
        return new AllocationOutcome(index, vehicleId, false, decision, decision.reason());
    }

    public static AllocationOutcome failed(int index, String vehicleId, String errorMessage) {
        return new AllocationOutcome(index, vehicleId, false, null, errorMessage);
    }

    @JsonIgnore
    public double score() {
        return success ? decision.score() : 0.0;
    }
}
