package com.marianbastiurea.parking.domain.services;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.errors.ScoringTimeoutException;
import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.*;
import com.marianbastiurea.parking.domain.policy.LearnedPolicy;
import com.marianbastiurea.parking.domain.policy.RandomPolicy;
import com.marianbastiurea.parking.domain.policy.SequentialPolicy;
import com.marianbastiurea.parking.domain.scoring.ScoringAdapter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static com.marianbastiurea.parking.support.Vehicles.*;
import static org.junit.jupiter.api.Assertions.*;

class SimulationRunnerTest {

    private final SimulationRunner runner = new SimulationRunner(7L, CLOCK);
    private final Facility twoByTwo = new Facility(2, 2);

    private static List<Cell> allocatedCells(SimulationReport report) {
        return report.outcomes().stream()
                .filter(AllocationOutcome::success)
                .map(o -> o.decision().cell())
                .toList();
    }

    @Test
    void sequentialFillsSmallFacilityAndRejectsTheOverflow() {
        SimulationReport report = runner.run(batch(5), new SequentialPolicy(CLOCK), twoByTwo, 0.0);

        assertEquals(PolicyKind.SEQUENTIAL, report.strategy());
        assertEquals(List.of(new Cell(0, 0), new Cell(0, 1), new Cell(1, 0), new Cell(1, 1)), allocatedCells(report));
        assertEquals(5, report.totalVehicles());
        assertEquals(4, report.successful());
        assertEquals(1, report.failed());
        assertEquals(0.8, report.successRate(), 1e-9);
        assertEquals(1.0, report.averageScore(), 1e-9);

        AllocationOutcome last = report.outcomes().get(4);
        assertFalse(last.success());
        assertEquals("V5", last.vehicleId());
        assertEquals(AllocationDecision.NO_CAPACITY, last.errorMessage());
        assertEquals(4, report.finalOccupancy().size());
    }

    @Test
    void capacityPlusOneRejectsExactlyTheLastRequest() {
        Facility facility = new Facility(3, 4);
        SimulationReport report = runner.run(batch(13), new RandomPolicy(new Random(5L), CLOCK), facility, 0.0);

        assertEquals(12, report.successful());
        for (int i = 0; i < 12; i++) {
            assertTrue(report.outcomes().get(i).success());
        }
        assertFalse(report.outcomes().get(12).success());
        assertEquals(12, allocatedCells(report).stream().distinct().count());
    }

    @Test
    void invalidRequestFailsAloneAndBatchContinues() {
        List<VehicleRequest> requests = new ArrayList<>(Arrays.asList(vehicle("A"), backwards("B"), null, vehicle("D")));

        SimulationReport report = runner.run(requests, new SequentialPolicy(CLOCK), twoByTwo, 0.0);

        assertEquals(4, report.totalVehicles());
        assertEquals(2, report.successful());
        assertEquals(2, report.failed());
        assertNull(report.outcomes().get(1).decision());
        assertTrue(report.outcomes().get(1).errorMessage().startsWith("Vehicle B: arrival"));
        assertEquals("#2", report.outcomes().get(2).vehicleId());
        assertEquals("Vehicle #2: malformed request", report.outcomes().get(2).errorMessage());
        assertNull(report.outcomes().get(2).decision());
        assertEquals(new Cell(0, 1), report.outcomes().get(3).decision().cell());
        assertEquals(report.successful() + report.failed(), report.totalVehicles());
    }

    @Test
    void scoringTimeoutBecomesFailedOutcome() {
        ScoringAdapter flaky = new ScoringAdapter() {
            int calls;

            @Override
            public List<ScoredCell> rankCandidates(VehicleRequest request, OccupancyGrid grid) {
                if (calls++ == 1) {
                    throw new ScoringTimeoutException("Scoring timed out after 5 ms");
                }
                return List.of(new ScoredCell(grid.freeCells().findFirst().orElseThrow(), 0.5));
            }

            @Override
            public double actionValue(VehicleRequest request, OccupancyGrid grid, Cell cell) {
                return 0.0;
            }
        };

        SimulationReport report = runner.run(batch(3), new LearnedPolicy(flaky, 0.0, CLOCK), twoByTwo, 0.0);

        assertTrue(report.outcomes().get(0).success());
        assertFalse(report.outcomes().get(1).success());
        assertEquals("Scoring timed out after 5 ms", report.outcomes().get(1).errorMessage());
        assertTrue(report.outcomes().get(2).success());
        assertEquals(0.5, report.averageScore(), 1e-9);
    }

    @Test
    void prefillReducesAvailableCells() {
        SimulationReport report = runner.run(batch(4), new SequentialPolicy(CLOCK), twoByTwo, 0.5);

        assertEquals(2, report.successful());
        assertEquals(4, report.finalOccupancy().size());
    }

    @Test
    void finalOccupancyIsBayMajor() {
        SimulationReport report = runner.run(batch(3), new RandomPolicy(new Random(11L), CLOCK), twoByTwo, 0.0);

        List<Cell> cells = new ArrayList<>(report.finalOccupancy().keySet());
        List<Cell> sorted = new ArrayList<>(cells);
        sorted.sort(Cell.BAY_MAJOR);
        assertEquals(3, cells.size());
        assertEquals(sorted, cells);
    }

    @Test
    void emptyBatchHasZeroRates() {
        SimulationReport report = runner.run(List.of(), new SequentialPolicy(CLOCK), twoByTwo, 0.0);

        assertEquals(0, report.totalVehicles());
        assertEquals(0.0, report.successRate());
        assertEquals(0.0, report.averageScore());
    }

    @Test
    void averageScoreIsZeroWhenNothingFits() {
        SimulationReport report = runner.run(batch(2), new SequentialPolicy(CLOCK), new Facility(1, 1), 1.0);

        assertEquals(0, report.successful());
        assertEquals(0.0, report.averageScore());
    }

    @Test
    void learnedWithConstantScoresMatchesSequentialRun() {
        SimulationReport learned = runner.run(batch(6), new LearnedPolicy(constantScoring(0.4, 0.1), 0.3, CLOCK), twoByTwo, 0.0);
        SimulationReport sequential = runner.run(batch(6), new SequentialPolicy(CLOCK), twoByTwo, 0.0);

        assertEquals(allocatedCells(sequential), allocatedCells(learned));
        assertEquals(sequential.successful(), learned.successful());
    }
}
