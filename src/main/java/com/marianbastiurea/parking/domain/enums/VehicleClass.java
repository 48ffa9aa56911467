package com.marianbastiurea.parking.domain.enums;

public enum VehicleClass {
    CAR,
    TRUCK,
    MOTORCYCLE
}
