package com.marianbastiurea.parking.domain.scoring;

import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.Cell;
import com.marianbastiurea.parking.domain.model.Facility;
import com.marianbastiurea.parking.domain.model.FeatureVector;
import com.marianbastiurea.parking.domain.model.ScoredCell;
import com.marianbastiurea.parking.domain.model.VehicleRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scores cells from the suitability model and the distance to the predicted
 * bay/slot preference:
 * <pre>score(cell) = suitability / (1 + |bay - preferredBay| + |slot - preferredSlot|)</pre>
 * Only the best {@code candidateLimit} cells are returned.
 */
public class ModelScoringAdapter implements ScoringAdapter {

    private static final Logger log = LoggerFactory.getLogger(ModelScoringAdapter.class);

    private final Facility facility;
    private final ModelBundle models;
    private final StateDiscretizer discretizer;
    private final int candidateLimit;

    public ModelScoringAdapter(Facility facility, ModelBundle models, StateDiscretizer discretizer, int candidateLimit) {
        this.facility = Objects.requireNonNull(facility, "facility");
        this.models = Objects.requireNonNull(models, "models");
        this.discretizer = Objects.requireNonNull(discretizer, "discretizer");
        if (candidateLimit < 1) {
            throw new IllegalArgumentException("candidateLimit must be >= 1");
        }
        this.candidateLimit = candidateLimit;

        ValueTable q = models.valueTable();
        if (q.actions() != facility.capacity()) {
            throw new IllegalArgumentException("Value table has " + q.actions()
                    + " actions but the facility has " + facility.capacity() + " cells");
        }
        if (q.states() != discretizer.stateCount()) {
            throw new IllegalArgumentException("Value table has " + q.states()
                    + " states but the discretizer produces " + discretizer.stateCount());
        }
    }

    @Override
    public List<ScoredCell> rankCandidates(VehicleRequest request, OccupancyGrid grid) {
        FeatureVector f = features(request, grid);
        double suitability = models.suitability().predict(f);
        int preferredBay = models.bayPreference().predictIndex(f, facility.numBays());
        int preferredSlot = models.slotPreference().predictIndex(f, facility.slotsPerBay());

        List<ScoredCell> scored = new ArrayList<>(facility.capacity());
        for (Cell cell : facility.cells()) {
            int distance = Math.abs(cell.bay() - preferredBay) + Math.abs(cell.slot() - preferredSlot);
            scored.add(new ScoredCell(cell, suitability / (1.0 + distance)));
        }
        scored.sort(ScoredCell.RANKING);
        List<ScoredCell> top = List.copyOf(scored.subList(0, Math.min(candidateLimit, scored.size())));

        if (log.isDebugEnabled()) {
            log.debug("Ranked vehicle={} features={} suitability={} preferred=({},{}) top={}",
                    request.vehicleId(), f, suitability, preferredBay, preferredSlot, top);
        }
        return top;
    }

    @Override
    public double actionValue(VehicleRequest request, OccupancyGrid grid, Cell cell) {
        int state = discretizer.state(features(request, grid));
        return models.valueTable().value(state, facility.actionId(cell));
    }
}
