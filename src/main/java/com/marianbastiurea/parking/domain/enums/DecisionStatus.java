package com.marianbastiurea.parking.domain.enums;

public enum DecisionStatus {
    ALLOCATED,
    REJECTED
}
