package com.marianbastiurea.parking.domain.enums;

public enum PlateType {
    PRIVATE,
    PUBLIC,
    GOVERNMENT
}
