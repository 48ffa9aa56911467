package com.marianbastiurea.parking.domain.model;

/** A live allocation attempt; {@code record} is null when the decision was rejected. */
public record LiveAllocation(AllocationDecision decision, AllocationRecord record) {

    public boolean allocated() {
        return record != null;
    }
}
