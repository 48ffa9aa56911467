package com.marianbastiurea.parking.domain.services;

import com.marianbastiurea.parking.domain.enums.ExpiryPolicy;
import com.marianbastiurea.parking.domain.model.Cell;
import com.marianbastiurea.parking.domain.model.Facility;
import com.marianbastiurea.parking.domain.model.FacilityStatus;
import com.marianbastiurea.parking.domain.model.FacilityStatus.BayStatus;
import com.marianbastiurea.parking.domain.model.FacilityStatus.SlotStatus;
import com.marianbastiurea.parking.domain.model.Reservation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the per-bay, per-slot status from a grid snapshot. The caller
 * captures {@code now} once and passes it in; it is used both for the expiry
 * check and as the report's timestamp.
 */
public final class FacilityStatusRenderer {

    private FacilityStatusRenderer() {
    }

    public static FacilityStatus render(Facility facility,
                                        Map<Cell, Reservation> snapshot,
                                        Instant now,
                                        ExpiryPolicy expiry) {
        Objects.requireNonNull(facility, "facility");
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(now, "now");
        Objects.requireNonNull(expiry, "expiry");

        List<BayStatus> bays = new ArrayList<>(facility.numBays());
        int occupied = 0;
        for (int b = 0; b < facility.numBays(); b++) {
            List<SlotStatus> slots = new ArrayList<>(facility.slotsPerBay());
            for (int s = 0; s < facility.slotsPerBay(); s++) {
                Reservation r = snapshot.get(new Cell(b, s));
                if (r != null && expiry == ExpiryPolicy.FILTER_ON_READ && r.hasElapsed(now)) {
                    r = null;
                }
                if (r != null) occupied++;
                slots.add(new SlotStatus(s + 1, r != null, r));
            }
            bays.add(new BayStatus(b + 1, List.copyOf(slots)));
        }

        int total = facility.capacity();
        double pct = Math.round(occupied * 1000.0 / total) / 10.0;
        return new FacilityStatus(List.copyOf(bays), total, occupied, total - occupied, pct, now);
    }
}
