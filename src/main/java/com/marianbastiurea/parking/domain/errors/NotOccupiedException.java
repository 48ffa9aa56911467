package com.marianbastiurea.parking.domain.errors;

import com.marianbastiurea.parking.domain.model.Cell;

public class NotOccupiedException extends ParkingException {

    private final Cell cell;

    public NotOccupiedException(Cell cell) {
        super("Cell " + cell + " is not occupied");
        this.cell = cell;
    }

    public Cell cell() {
        return cell;
    }
}
