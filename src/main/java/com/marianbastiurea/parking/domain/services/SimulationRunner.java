package com.marianbastiurea.parking.domain.services;

import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.AllocationDecision;
import com.marianbastiurea.parking.domain.model.AllocationOutcome;
import com.marianbastiurea.parking.domain.model.Facility;
import com.marianbastiurea.parking.domain.model.SimulationReport;
import com.marianbastiurea.parking.domain.model.VehicleRequest;
import com.marianbastiurea.parking.domain.policy.AllocationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Replays requests in input order against a private grid. Each allocated
 * decision is committed before the next request is decided, and any
 * per-request exception becomes a failed outcome without stopping the batch.
 * A null entry stands for an input that could not be parsed and is reported
 * as a failed outcome keyed {@code #index}.
 */
public class SimulationRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunner.class);

    private final long fillSeed;
    private final Clock clock;

    public SimulationRunner(long fillSeed, Clock clock) {
        this.fillSeed = fillSeed;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SimulationReport run(List<VehicleRequest> requests,
                                AllocationPolicy policy,
                                Facility facility,
                                double initialFillRatio) {
        Objects.requireNonNull(requests, "requests");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(facility, "facility");

        OccupancyGrid grid = new OccupancyGrid(facility, fillSeed, clock);
        grid.reset(initialFillRatio);

        log.info("Start simulation strategy={} | vehicles={} | facility={}x{} | fillRatio={}",
                policy.kind(), requests.size(), facility.numBays(), facility.slotsPerBay(), initialFillRatio);

        List<AllocationOutcome> outcomes = new ArrayList<>(requests.size());
        long t0 = System.nanoTime();

        for (int i = 0; i < requests.size(); i++) {
            VehicleRequest request = requests.get(i);
            String vehicleId = request == null ? "#" + i : request.vehicleId();
            MDC.put("vehicleId", vehicleId);
            try {
                if (request == null) {
                    String message = "Vehicle " + vehicleId + ": malformed request";
                    outcomes.add(AllocationOutcome.failed(i, vehicleId, message));
                    log.warn("Vehicle {} failed in simulation: {}", vehicleId, message);
                    continue;
                }
                AllocationDecision decision = policy.decide(request, grid);
                if (decision.isAllocated()) {
                    grid.occupy(decision.cell(), request.toReservation());
                    outcomes.add(AllocationOutcome.allocated(i, vehicleId, decision));
                    if (log.isTraceEnabled()) {
                        log.trace("Vehicle {} -> bay={} slot={} score={}",
                                vehicleId, decision.bayAssigned(), decision.slotAssigned(), decision.score());
                    }
                } else {
                    outcomes.add(AllocationOutcome.rejected(i, vehicleId, decision));
                    log.debug("Vehicle {} rejected: {}", vehicleId, decision.reason());
                }
            } catch (RuntimeException ex) {
                String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                outcomes.add(AllocationOutcome.failed(i, vehicleId, message));
                log.warn("Vehicle {} failed in simulation: {}", vehicleId, message);
            } finally {
                MDC.remove("vehicleId");
            }
        }

        Duration took = Duration.ofNanos(System.nanoTime() - t0);
        SimulationReport report = SimulationReport.of(policy.kind(), outcomes, took, grid.snapshot());
        log.info("Completed simulation strategy={} in {} ms | success={} | failed={} | rate={} | avgScore={}",
                report.strategy(), took.toMillis(), report.successful(), report.failed(),
                report.successRate(), report.averageScore());
        return report;
    }
}
