package com.marianbastiurea.parking.domain.errors;

/** Malformed vehicle request, e.g. arrival not strictly before departure. */
public class InvalidRequestException extends ParkingException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
