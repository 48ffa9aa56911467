package com.marianbastiurea.parking.domain.model;

import com.marianbastiurea.parking.domain.enums.PlateType;
import com.marianbastiurea.parking.domain.enums.VehicleClass;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * An arriving vehicle. The time window and id length are not validated here;
 * policies reject a window whose arrival is not before its departure and an id
 * longer than {@link #MAX_VEHICLE_ID_LENGTH}.
 */
public record VehicleRequest(
        String vehicleId,
        PlateType plateType,
        VehicleClass vehicleClass,
        OffsetDateTime arrivalTime,
        OffsetDateTime departureTime,
        int priorityLevel
) {
    public static final int MAX_VEHICLE_ID_LENGTH = 64;

    public VehicleRequest {
        Objects.requireNonNull(vehicleId, "vehicleId");
        Objects.requireNonNull(arrivalTime, "arrivalTime");
        Objects.requireNonNull(departureTime, "departureTime");
        plateType = plateType == null ? PlateType.PRIVATE : plateType;
        vehicleClass = vehicleClass == null ? VehicleClass.CAR : vehicleClass;
    }

    public boolean hasValidWindow() {
        return arrivalTime.isBefore(departureTime);
    }

    public double durationHours() {
        return Duration.between(arrivalTime, departureTime).toMillis() / 3_600_000.0;
    }

    /** 0 = Monday ... 6 = Sunday, in the arrival's own offset. */
    public int dayOfWeek() {
        return arrivalTime.getDayOfWeek().getValue() - 1;
    }

    public int hourOfDay() {
        return arrivalTime.getHour();
    }

    public Reservation toReservation() {
        return new Reservation(vehicleId, arrivalTime.toInstant(), departureTime.toInstant(), priorityLevel);
    }
}
