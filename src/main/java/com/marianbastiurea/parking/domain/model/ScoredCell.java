package com.marianbastiurea.parking.domain.model;

import java.util.Comparator;

public record ScoredCell(Cell cell, double score) {

    /** Highest score first, ties by ascending (bay, slot). */
    public static final Comparator<ScoredCell> RANKING =
            Comparator.comparingDouble(ScoredCell::score).reversed()
                    .thenComparing(ScoredCell::cell, Cell.BAY_MAJOR);
}
