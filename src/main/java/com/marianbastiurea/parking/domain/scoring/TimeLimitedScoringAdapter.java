package com.marianbastiurea.parking.domain.scoring;

import com.marianbastiurea.parking.domain.errors.ScoringTimeoutException;
import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.Cell;
import com.marianbastiurea.parking.domain.model.FeatureVector;
import com.marianbastiurea.parking.domain.model.ScoredCell;
import com.marianbastiurea.parking.domain.model.VehicleRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs candidate ranking on an executor and gives up after a timeout. The
 * delegate sees a detached copy of the grid so a late task never races with
 * the caller's next write. Value-table lookups are in memory and run inline.
 */
public class TimeLimitedScoringAdapter implements ScoringAdapter {

    private static final Logger log = LoggerFactory.getLogger(TimeLimitedScoringAdapter.class);

    private final ScoringAdapter delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    public TimeLimitedScoringAdapter(ScoringAdapter delegate, ExecutorService executor, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    @Override
    public FeatureVector features(VehicleRequest request, OccupancyGrid grid) {
        return delegate.features(request, grid);
    }

    @Override
    public List<ScoredCell> rankCandidates(VehicleRequest request, OccupancyGrid grid) {
        OccupancyGrid detached = grid.copy();
        long t0 = System.nanoTime();
        Future<List<ScoredCell>> future = executor.submit(() -> delegate.rankCandidates(request, detached));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Scoring timed out for vehicle={} after {} ms.", request.vehicleId(), timeout.toMillis());
            throw new ScoringTimeoutException("Scoring timed out after " + timeout.toMillis() + " ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ScoringTimeoutException("Interrupted while waiting for scoring", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            log.error("Scoring failed for vehicle={} in {} ms: {}",
                    request.vehicleId(), (System.nanoTime() - t0) / 1_000_000, String.valueOf(cause));
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Scoring failed for vehicle " + request.vehicleId(), cause);
        }
    }

    @Override
    public double actionValue(VehicleRequest request, OccupancyGrid grid, Cell cell) {
        return delegate.actionValue(request, grid, cell);
    }
}
