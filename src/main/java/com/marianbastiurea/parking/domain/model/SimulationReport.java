package com.marianbastiurea.parking.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.marianbastiurea.parking.domain.enums.PolicyKind;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate over one batch. {@code averageScore} is the mean score of the
 * successful outcomes and is 0.0 when nothing was allocated; {@code successRate}
 * is 0.0 for an empty batch. {@code finalOccupancy} keeps the grid's bay-major order.
 */
public record SimulationReport(
        PolicyKind strategy,
        int totalVehicles,
        int successful,
        int failed,
        double successRate,
        double averageScore,
        Duration totalProcessingTime,
        List<AllocationOutcome> outcomes,
        @JsonIgnore Map<Cell, Reservation> finalOccupancy
) {
    public SimulationReport {
        outcomes = List.copyOf(outcomes);
        finalOccupancy = Collections.unmodifiableMap(new LinkedHashMap<>(finalOccupancy));
    }

    public static SimulationReport of(PolicyKind strategy,
                                      List<AllocationOutcome> outcomes,
                                      Duration processingTime,
                                      Map<Cell, Reservation> finalOccupancy) {
        int total = outcomes.size();
        int ok = 0;
        double scoreSum = 0.0;
        for (AllocationOutcome o : outcomes) {
            if (o.success()) {
                ok++;
                scoreSum += o.score();
            }
        }
        double rate = total == 0 ? 0.0 : (double) ok / total;
        double avg = ok == 0 ? 0.0 : scoreSum / ok;
        return new SimulationReport(strategy, total, ok, total - ok, rate, avg, processingTime, outcomes, finalOccupancy);
    }
}
