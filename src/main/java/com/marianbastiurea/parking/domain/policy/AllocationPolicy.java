package com.marianbastiurea.parking.domain.policy;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.AllocationDecision;
import com.marianbastiurea.parking.domain.model.VehicleRequest;

/**
 * Chooses a cell for a request. {@code decide} is a pure query: it never
 * occupies the chosen cell, and a full facility yields a rejected decision
 * rather than an exception.
 */
public sealed interface AllocationPolicy permits LearnedPolicy, SequentialPolicy, RandomPolicy {

    PolicyKind kind();

    /**
     * @throws com.marianbastiurea.parking.domain.errors.InvalidRequestException
     *         if the request's arrival is not before its departure
     */
    AllocationDecision decide(VehicleRequest request, OccupancyGrid grid);
}
