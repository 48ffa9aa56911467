package com.marianbastiurea.parking.domain.enums;

/**
 * How the status renderer treats reservations whose departure time has passed.
 */
public enum ExpiryPolicy {
    /** Elapsed reservations are reported as free, even if never released from the grid. */
    FILTER_ON_READ,
    /** Every recorded reservation is reported as occupied. */
    TRUST_GRID
}
