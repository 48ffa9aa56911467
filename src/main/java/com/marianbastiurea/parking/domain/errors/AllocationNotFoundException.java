package com.marianbastiurea.parking.domain.errors;

public class AllocationNotFoundException extends ParkingException {

    public AllocationNotFoundException(long id) {
        super("Allocation with ID " + id + " not found");
    }
}
