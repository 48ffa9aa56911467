package com.marianbastiurea.parking.domain.model;

import java.time.Instant;

/** Partial update of an allocation record; null fields are left unchanged. */
public record AllocationPatch(Instant departureTime, Integer priorityLevel, Boolean active) {

    public static AllocationPatch deactivate() {
        return new AllocationPatch(null, null, Boolean.FALSE);
    }

    public boolean isEmpty() {
        return departureTime == null && priorityLevel == null && active == null;
    }
}
