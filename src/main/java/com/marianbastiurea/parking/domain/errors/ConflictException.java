package com.marianbastiurea.parking.domain.errors;

import com.marianbastiurea.parking.domain.model.Cell;

/** Occupy of a cell that already holds a reservation. */
public class ConflictException extends ParkingException {

    private final Cell cell;

    public ConflictException(Cell cell, String heldBy) {
        super("Cell " + cell + " is already occupied by " + heldBy);
        this.cell = cell;
    }

    public Cell cell() {
        return cell;
    }
}
