package com.marianbastiurea.parking.domain.scoring;

import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.Cell;
import com.marianbastiurea.parking.domain.model.FeatureVector;
import com.marianbastiurea.parking.domain.model.ScoredCell;
import com.marianbastiurea.parking.domain.model.VehicleRequest;

import java.util.List;

/**
 * Uniform access to the externally trained scoring functions and value table.
 * Implementations must not mutate the grid.
 */
public interface ScoringAdapter {

    default FeatureVector features(VehicleRequest request, OccupancyGrid grid) {
        return new FeatureVector(
                request.durationHours(),
                request.dayOfWeek(),
                request.hourOfDay(),
                request.priorityLevel(),
                grid.occupancyRatio()
        );
    }

    /**
     * Candidate cells ordered by {@link ScoredCell#RANKING}. The list may contain
     * occupied cells and need not cover the whole facility.
     */
    List<ScoredCell> rankCandidates(VehicleRequest request, OccupancyGrid grid);

    /** Value-table entry for the grid's current discretized state and the cell's action. */
    double actionValue(VehicleRequest request, OccupancyGrid grid, Cell cell);
}
