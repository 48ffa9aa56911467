package com.marianbastiurea.parking.api.dto;

import com.marianbastiurea.parking.domain.model.AllocationPatch;

import java.time.OffsetDateTime;

public record UpdateAllocationRequest(
        OffsetDateTime departureTime,
        Integer priorityLevel
) {
    public AllocationPatch toPatch() {
        return new AllocationPatch(departureTime == null ? null : departureTime.toInstant(), priorityLevel, null);
    }
}
