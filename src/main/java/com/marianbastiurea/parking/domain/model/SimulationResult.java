package com.marianbastiurea.parking.domain.model;

public record SimulationResult(SimulationReport report, FacilityStatus finalStatus) {}
