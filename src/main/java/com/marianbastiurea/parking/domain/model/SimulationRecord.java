package com.marianbastiurea.parking.domain.model;

import com.marianbastiurea.parking.domain.enums.PolicyKind;

import java.time.Instant;

/** Archived summary of one simulation run. */
public record SimulationRecord(
        PolicyKind strategy,
        Instant executedAt,
        int totalVehicles,
        int successful,
        int failed,
        double successRate,
        double averageScore,
        long processingMillis
) {
    public static SimulationRecord of(SimulationReport report, Instant executedAt) {
        return new SimulationRecord(
                report.strategy(),
                executedAt,
                report.totalVehicles(),
                report.successful(),
                report.failed(),
                report.successRate(),
                report.averageScore(),
                report.totalProcessingTime().toMillis()
        );
    }
}
