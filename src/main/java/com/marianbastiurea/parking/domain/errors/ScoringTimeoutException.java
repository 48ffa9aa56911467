package com.marianbastiurea.parking.domain.errors;

public class ScoringTimeoutException extends ParkingException {

    public ScoringTimeoutException(String message) {
        super(message);
    }

    public ScoringTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
