package com.marianbastiurea.parking.api.dto;

import java.util.List;

/** Body of {@code /simulate} and {@code /compare}; {@code strategy} is ignored by the latter. */
public record SimulationRequestDto(
        List<VehicleRequestDto> vehicles,
        String strategy,
        Double initialFillRatio
) {}
