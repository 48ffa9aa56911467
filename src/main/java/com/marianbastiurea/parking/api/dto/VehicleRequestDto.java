package com.marianbastiurea.parking.api.dto;

import com.marianbastiurea.parking.domain.enums.PlateType;
import com.marianbastiurea.parking.domain.enums.VehicleClass;
import com.marianbastiurea.parking.domain.errors.InvalidRequestException;
import com.marianbastiurea.parking.domain.model.VehicleRequest;

import java.time.OffsetDateTime;

public record VehicleRequestDto(
        String vehicleId,
        PlateType plateType,
        VehicleClass vehicleClass,
        OffsetDateTime arrivalTime,
        OffsetDateTime departureTime,
        Integer priorityLevel
) {
    public VehicleRequest toDomain() {
        if (vehicleId == null || vehicleId.isBlank()) {
            throw new InvalidRequestException("vehicleId is required");
        }
        if (vehicleId.trim().length() > VehicleRequest.MAX_VEHICLE_ID_LENGTH) {
            throw new InvalidRequestException("vehicleId exceeds " + VehicleRequest.MAX_VEHICLE_ID_LENGTH + " characters");
        }
        if (arrivalTime == null || departureTime == null) {
            throw new InvalidRequestException("arrivalTime and departureTime are required for " + vehicleId);
        }
        return new VehicleRequest(vehicleId.trim(), plateType, vehicleClass, arrivalTime, departureTime,
                priorityLevel == null ? 1 : priorityLevel);
    }
}
