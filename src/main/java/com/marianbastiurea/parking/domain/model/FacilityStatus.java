package com.marianbastiurea.parking.domain.model;

import java.time.Instant;
import java.util.List;

public record FacilityStatus(
        List<BayStatus> bays,
        int totalSlots,
        int occupiedSlots,
        int availableSlots,
        double occupancyPercentage,
        Instant updatedAt
) {
    public record BayStatus(int bayNumber, List<SlotStatus> slots) {}

    public record SlotStatus(int slotNumber, boolean occupied, Reservation reservation) {}
}
