package com.marianbastiurea.parking.domain.policy;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.AllocationDecision;
import com.marianbastiurea.parking.domain.model.Cell;
import com.marianbastiurea.parking.domain.model.ScoredCell;
import com.marianbastiurea.parking.domain.model.VehicleRequest;
import com.marianbastiurea.parking.domain.scoring.ScoringAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Blends the model score of each ranked candidate with its value-table entry:
 * <pre>combined = (1 - w) * modelScore + w * actionValue</pre>
 * and takes the best free candidate, ties to the lower (bay, slot).
 * <p>
 * When every ranked candidate is occupied it scans all free cells with
 * {@code combined = w * actionValue}, so it only rejects when the facility is full.
 */
public final class LearnedPolicy implements AllocationPolicy {

    private static final Logger log = LoggerFactory.getLogger(LearnedPolicy.class);

    private final ScoringAdapter scoring;
    private final double blendWeight;
    private final Clock clock;

    public LearnedPolicy(ScoringAdapter scoring, double blendWeight, Clock clock) {
        this.scoring = Objects.requireNonNull(scoring, "scoring");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (Double.isNaN(blendWeight) || blendWeight < 0.0 || blendWeight > 1.0) {
            throw new IllegalArgumentException("blendWeight must be in [0,1], got " + blendWeight);
        }
        this.blendWeight = blendWeight;
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.LEARNED;
    }

    @Override
    public AllocationDecision decide(VehicleRequest request, OccupancyGrid grid) {
        RequestValidation.requireValid(request);

        List<ScoredCell> ranked = scoring.rankCandidates(request, grid);
        Best best = new Best();
        for (ScoredCell candidate : ranked) {
            if (!grid.isFree(candidate.cell())) continue;
            double q = scoring.actionValue(request, grid, candidate.cell());
            best.offer(candidate.cell(), (1.0 - blendWeight) * candidate.score() + blendWeight * q);
        }

        if (best.cell == null) {
            Iterator<Cell> free = grid.freeCells().iterator();
            if (!free.hasNext()) {
                return AllocationDecision.rejected(clock.instant(), kind());
            }
            if (log.isDebugEnabled()) {
                log.debug("All {} ranked candidate(s) occupied for vehicle={}, scanning free cells.",
                        ranked.size(), request.vehicleId());
            }
            while (free.hasNext()) {
                Cell cell = free.next();
                best.offer(cell, blendWeight * scoring.actionValue(request, grid, cell));
            }
        }

        return AllocationDecision.allocated(best.cell, best.score, clock.instant(), kind());
    }

    private static final class Best {
        Cell cell;
        double score;

        void offer(Cell candidate, double candidateScore) {
            if (cell == null
                    || candidateScore > score
                    || (candidateScore == score && candidate.compareTo(cell) < 0)) {
                cell = candidate;
                score = candidateScore;
            }
        }
    }
}
