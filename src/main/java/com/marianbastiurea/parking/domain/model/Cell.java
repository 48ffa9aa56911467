package com.marianbastiurea.parking.domain.model;

import java.util.Comparator;

/** A (bay, slot) position, both 0-based. */
public record Cell(int bay, int slot) implements Comparable<Cell> {

    public static final Comparator<Cell> BAY_MAJOR =
            Comparator.comparingInt(Cell::bay).thenComparingInt(Cell::slot);

    public Cell {
        if (bay < 0 || slot < 0) {
            throw new IllegalArgumentException("bay and slot must be >= 0, got (" + bay + "," + slot + ")");
        }
    }

    public int bayNumber() {
        return bay + 1;
    }

    public int slotNumber() {
        return slot + 1;
    }

    public static Cell ofNumbers(int bayNumber, int slotNumber) {
        return new Cell(bayNumber - 1, slotNumber - 1);
    }

    @Override
    public int compareTo(Cell other) {
        return BAY_MAJOR.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + bay + "," + slot + ")";
    }
}
