package com.marianbastiurea.parking.domain.model;

import com.marianbastiurea.parking.domain.enums.Ledger;

import java.util.Objects;

public record AllocationFilter(Ledger ledger, boolean activeOnly, String vehicleId) {

    public AllocationFilter {
        Objects.requireNonNull(ledger, "ledger");
    }

    public static AllocationFilter all(Ledger ledger) {
        return new AllocationFilter(ledger, false, null);
    }

    public static AllocationFilter active(Ledger ledger) {
        return new AllocationFilter(ledger, true, null);
    }

    public boolean matches(AllocationRecord r) {
        if (r.ledger() != ledger) return false;
        if (activeOnly && !r.active()) return false;
        return vehicleId == null || vehicleId.equals(r.vehicleId());
    }
}
