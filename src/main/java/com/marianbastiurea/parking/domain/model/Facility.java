package com.marianbastiurea.parking.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed shape of a parking facility. Actions of the value table are the
 * flattened cell ids {@code bay * slotsPerBay + slot}.
 */
public record Facility(int numBays, int slotsPerBay) {

    public Facility {
        if (numBays < 1) throw new IllegalArgumentException("numBays must be >= 1");
        if (slotsPerBay < 1) throw new IllegalArgumentException("slotsPerBay must be >= 1");
    }

    public int capacity() {
        return numBays * slotsPerBay;
    }

    public boolean contains(Cell cell) {
        return cell != null && cell.bay() < numBays && cell.slot() < slotsPerBay;
    }

    public Cell requireCell(Cell cell) {
        if (!contains(cell)) {
            throw new IllegalArgumentException("Cell " + cell + " is outside facility " + numBays + "x" + slotsPerBay);
        }
        return cell;
    }

    public int actionId(Cell cell) {
        requireCell(cell);
        return cell.bay() * slotsPerBay + cell.slot();
    }

    public Cell cellForAction(int actionId) {
        if (actionId < 0 || actionId >= capacity()) {
            throw new IllegalArgumentException("actionId out of range: " + actionId);
        }
        return new Cell(actionId / slotsPerBay, actionId % slotsPerBay);
    }

    /** All cells, bay-major then slot-minor. */
    public List<Cell> cells() {
        List<Cell> out = new ArrayList<>(capacity());
        for (int b = 0; b < numBays; b++) {
            for (int s = 0; s < slotsPerBay; s++) {
                out.add(new Cell(b, s));
            }
        }
        return Collections.unmodifiableList(out);
    }
}
