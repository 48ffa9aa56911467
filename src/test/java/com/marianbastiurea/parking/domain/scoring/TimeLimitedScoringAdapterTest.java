package com.marianbastiurea.parking.domain.scoring;

import com.marianbastiurea.parking.domain.errors.ScoringTimeoutException;
import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.Cell;
import com.marianbastiurea.parking.domain.model.Facility;
import com.marianbastiurea.parking.domain.model.ScoredCell;
import com.marianbastiurea.parking.domain.model.VehicleRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

import static com.marianbastiurea.parking.support.Vehicles.CLOCK;
import static com.marianbastiurea.parking.support.Vehicles.vehicle;
import static org.junit.jupiter.api.Assertions.*;

class TimeLimitedScoringAdapterTest {

    private ExecutorService executor;
    private OccupancyGrid grid;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        grid = new OccupancyGrid(new Facility(2, 2), 7L, CLOCK);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ScoringAdapter ranking(BiFunction<VehicleRequest, OccupancyGrid, List<ScoredCell>> fn) {
        return new ScoringAdapter() {
            @Override
            public List<ScoredCell> rankCandidates(VehicleRequest request, OccupancyGrid g) {
                return fn.apply(request, g);
            }

            @Override
            public double actionValue(VehicleRequest request, OccupancyGrid g, Cell cell) {
                return 0.25;
            }
        };
    }

    @Test
    void returnsDelegateRankingWithinTimeout() {
        List<ScoredCell> expected = List.of(new ScoredCell(new Cell(0, 1), 0.7));
        TimeLimitedScoringAdapter adapter = new TimeLimitedScoringAdapter(
                ranking((r, g) -> expected), executor, Duration.ofSeconds(5));

        assertEquals(expected, adapter.rankCandidates(vehicle("A"), grid));
        assertEquals(0.25, adapter.actionValue(vehicle("A"), grid, new Cell(0, 0)), 1e-9);
    }

    @Test
    void delegateSeesDetachedCopy() {
        AtomicReference<OccupancyGrid> seen = new AtomicReference<>();
        TimeLimitedScoringAdapter adapter = new TimeLimitedScoringAdapter(
                ranking((r, g) -> {
                    seen.set(g);
                    g.occupy(new Cell(1, 1), r.toReservation());
                    return List.of();
                }), executor, Duration.ofSeconds(5));

        adapter.rankCandidates(vehicle("A"), grid);

        assertNotSame(grid, seen.get());
        assertTrue(grid.isFree(new Cell(1, 1)));
    }

    @Test
    void slowRankingTimesOut() {
        CountDownLatch never = new CountDownLatch(1);
        TimeLimitedScoringAdapter adapter = new TimeLimitedScoringAdapter(
                ranking((r, g) -> {
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return List.of();
                }), executor, Duration.ofMillis(50));

        assertThrows(ScoringTimeoutException.class, () -> adapter.rankCandidates(vehicle("A"), grid));
    }

    @Test
    void delegateFailureIsRethrownAsIs() {
        TimeLimitedScoringAdapter adapter = new TimeLimitedScoringAdapter(
                ranking((r, g) -> {
                    throw new IllegalStateException("model broken");
                }), executor, Duration.ofSeconds(5));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> adapter.rankCandidates(vehicle("A"), grid));
        assertEquals("model broken", ex.getMessage());
    }

    @Test
    void timeoutMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new TimeLimitedScoringAdapter(ranking((r, g) -> List.of()), executor, Duration.ZERO));
    }
}
