package com.marianbastiurea.parking.domain.policy;

import com.marianbastiurea.parking.domain.errors.InvalidRequestException;
import com.marianbastiurea.parking.domain.model.VehicleRequest;

import java.util.Objects;

final class RequestValidation {

    private RequestValidation() {
    }

    static VehicleRequest requireValid(VehicleRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.vehicleId().length() > VehicleRequest.MAX_VEHICLE_ID_LENGTH) {
            throw new InvalidRequestException("vehicleId exceeds " + VehicleRequest.MAX_VEHICLE_ID_LENGTH
                    + " characters: " + request.vehicleId().substring(0, 16) + "...");
        }
        if (!request.hasValidWindow()) {
            throw new InvalidRequestException("Vehicle " + request.vehicleId() + ": arrival "
                    + request.arrivalTime() + " must be before departure " + request.departureTime());
        }
        return request;
    }
}
