package com.marianbastiurea.parking.domain.grid;

import com.marianbastiurea.parking.domain.errors.ConflictException;
import com.marianbastiurea.parking.domain.errors.NotOccupiedException;
import com.marianbastiurea.parking.domain.model.Cell;
import com.marianbastiurea.parking.domain.model.Facility;
import com.marianbastiurea.parking.domain.model.Reservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Stream;

/**
 * Occupancy state of every cell of one facility.
 * <p>
 * A cell is occupied while a reservation is recorded for it; expiry by time is
 * applied only through {@link #releaseExpired(Instant)} or by the status renderer.
 * {@link #occupy} and {@link #release} are the only write paths.
 * <p>
 * Not thread-safe. Callers sharing an instance must serialize writers.
 */
public class OccupancyGrid {

    private static final Logger log = LoggerFactory.getLogger(OccupancyGrid.class);

    static final Duration PREFILL_STAY = Duration.ofHours(2);

    private final Facility facility;
    private final long fillSeed;
    private final Clock clock;
    private final Reservation[][] cells;
    private int occupied;

    public OccupancyGrid(Facility facility, long fillSeed, Clock clock) {
        this.facility = Objects.requireNonNull(facility, "facility");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fillSeed = fillSeed;
        this.cells = new Reservation[facility.numBays()][facility.slotsPerBay()];
    }

    public Facility facility() {
        return facility;
    }

    /**
     * Clears every reservation, then pre-occupies {@code round(ratio * capacity)}
     * cells chosen by a {@link Random} seeded with the grid's fill seed.
     */
    public void reset(double initialFillRatio) {
        requireRatio(initialFillRatio);
        clear();
        prefill(initialFillRatio);
    }

    public void clear() {
        for (Reservation[] bay : cells) {
            Arrays.fill(bay, null);
        }
        occupied = 0;
    }

    /**
     * Pre-occupies free cells, in the seeded shuffle order, until
     * {@code round(ratio * capacity)} cells are occupied. Cells already held
     * are left alone. Returns the number of cells pre-occupied.
     */
    public int prefill(double fillRatio) {
        requireRatio(fillRatio);
        int target = (int) Math.round(fillRatio * facility.capacity());
        if (occupied >= target) {
            log.debug("Grid prefill skipped: {} of {} cells already occupied (target {}).",
                    occupied, facility.capacity(), target);
            return 0;
        }

        List<Cell> all = new ArrayList<>(facility.cells());
        Collections.shuffle(all, new Random(fillSeed));
        Instant arrival = clock.instant();
        Instant departure = arrival.plus(PREFILL_STAY);
        int added = 0;
        for (Cell cell : all) {
            if (occupied >= target) break;
            if (cells[cell.bay()][cell.slot()] != null) continue;
            added++;
            occupy(cell, new Reservation(String.format("PREFILL-%03d", added), arrival, departure, 0));
        }
        log.debug("Grid prefill with fillRatio={} -> {} cells pre-occupied, {} of {} occupied (seed={}).",
                fillRatio, added, occupied, facility.capacity(), fillSeed);
        return added;
    }

    private static void requireRatio(double ratio) {
        if (Double.isNaN(ratio) || ratio < 0.0 || ratio > 1.0) {
            throw new IllegalArgumentException("initialFillRatio must be in [0,1], got " + ratio);
        }
    }

    public boolean isFree(Cell cell) {
        facility.requireCell(cell);
        return cells[cell.bay()][cell.slot()] == null;
    }

    public Optional<Reservation> reservationAt(Cell cell) {
        facility.requireCell(cell);
        return Optional.ofNullable(cells[cell.bay()][cell.slot()]);
    }

    public void occupy(Cell cell, Reservation reservation) {
        facility.requireCell(cell);
        Objects.requireNonNull(reservation, "reservation");
        Reservation held = cells[cell.bay()][cell.slot()];
        if (held != null) {
            throw new ConflictException(cell, held.vehicleId());
        }
        cells[cell.bay()][cell.slot()] = reservation;
        occupied++;
    }

    public Reservation release(Cell cell) {
        facility.requireCell(cell);
        Reservation held = cells[cell.bay()][cell.slot()];
        if (held == null) {
            throw new NotOccupiedException(cell);
        }
        cells[cell.bay()][cell.slot()] = null;
        occupied--;
        return held;
    }

    /** Releases every reservation whose departure time is at or before {@code now}. */
    public int releaseExpired(Instant now) {
        int released = 0;
        for (Cell cell : facility.cells()) {
            Reservation r = cells[cell.bay()][cell.slot()];
            if (r != null && r.hasElapsed(now)) {
                release(cell);
                released++;
            }
        }
        if (released > 0 && log.isDebugEnabled()) {
            log.debug("Released {} expired reservation(s) at {}.", released, now);
        }
        return released;
    }

    /** Free cells, bay-major then slot-minor, evaluated lazily. */
    public Stream<Cell> freeCells() {
        return facility.cells().stream().filter(c -> cells[c.bay()][c.slot()] == null);
    }

    public int occupiedCount() {
        return occupied;
    }

    public double occupancyRatio() {
        return (double) occupied / facility.capacity();
    }

    /** Read-only view of the occupied cells, in bay-major order. */
    public Map<Cell, Reservation> snapshot() {
        Map<Cell, Reservation> out = new LinkedHashMap<>();
        for (Cell cell : facility.cells()) {
            Reservation r = cells[cell.bay()][cell.slot()];
            if (r != null) out.put(cell, r);
        }
        return Collections.unmodifiableMap(out);
    }

    /** Detached copy; later writes to either grid are not seen by the other. */
    public OccupancyGrid copy() {
        OccupancyGrid c = new OccupancyGrid(facility, fillSeed, clock);
        for (int b = 0; b < cells.length; b++) {
            System.arraycopy(cells[b], 0, c.cells[b], 0, cells[b].length);
        }
        c.occupied = occupied;
        return c;
    }
}
