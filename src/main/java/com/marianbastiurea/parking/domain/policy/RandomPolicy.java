package com.marianbastiurea.parking.domain.policy;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.AllocationDecision;
import com.marianbastiurea.parking.domain.model.Cell;
import com.marianbastiurea.parking.domain.model.VehicleRequest;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/** Uniform choice among the free cells. Reproducible for a given {@link Random} seed. */
public final class RandomPolicy implements AllocationPolicy {

    public static final double SCORE = 1.0;

    private final Random random;
    private final Clock clock;

    public RandomPolicy(Random random, Clock clock) {
        this.random = Objects.requireNonNull(random, "random");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.RANDOM;
    }

    @Override
    public AllocationDecision decide(VehicleRequest request, OccupancyGrid grid) {
        RequestValidation.requireValid(request);
        List<Cell> free = grid.freeCells().toList();
        if (free.isEmpty()) {
            return AllocationDecision.rejected(clock.instant(), kind());
        }
        Cell pick = free.get(random.nextInt(free.size()));
        return AllocationDecision.allocated(pick, SCORE, clock.instant(), kind());
    }
}
