package com.marianbastiurea.parking.domain.policy;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.AllocationDecision;
import com.marianbastiurea.parking.domain.model.VehicleRequest;

import java.time.Clock;
import java.util.Objects;

/** First free cell in bay-major order. */
public final class SequentialPolicy implements AllocationPolicy {

    public static final double SCORE = 1.0;

    private final Clock clock;

    public SequentialPolicy(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.SEQUENTIAL;
    }

    @Override
    public AllocationDecision decide(VehicleRequest request, OccupancyGrid grid) {
        RequestValidation.requireValid(request);
        return grid.freeCells()
                .findFirst()
                .map(cell -> AllocationDecision.allocated(cell, SCORE, clock.instant(), kind()))
                .orElseGet(() -> AllocationDecision.rejected(clock.instant(), kind()));
    }
}
