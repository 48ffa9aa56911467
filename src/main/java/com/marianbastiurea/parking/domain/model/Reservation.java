package com.marianbastiurea.parking.domain.model;

import java.time.Instant;
import java.util.Objects;

public record Reservation(
        String vehicleId,
        Instant arrivalTime,
        Instant departureTime,
        int priorityLevel
) {
    public Reservation {
        Objects.requireNonNull(vehicleId, "vehicleId");
        Objects.requireNonNull(arrivalTime, "arrivalTime");
        Objects.requireNonNull(departureTime, "departureTime");
        if (!departureTime.isAfter(arrivalTime)) {
            throw new IllegalArgumentException("departureTime must be after arrivalTime for " + vehicleId);
        }
    }

    /** True once {@code now} has reached the departure time. */
    public boolean hasElapsed(Instant now) {
        return !now.isBefore(departureTime);
    }

    public Reservation withDeparture(Instant newDeparture) {
        return new Reservation(vehicleId, arrivalTime, newDeparture, priorityLevel);
    }
}
