package com.marianbastiurea.parking.domain.scoring;

import java.util.Objects;

/** The trained parameters consumed by {@link ModelScoringAdapter}. */
public record ModelBundle(
        LinearModel suitability,
        LinearModel bayPreference,
        LinearModel slotPreference,
        ValueTable valueTable
) {
    public ModelBundle {
        Objects.requireNonNull(suitability, "suitability");
        Objects.requireNonNull(bayPreference, "bayPreference");
        Objects.requireNonNull(slotPreference, "slotPreference");
        Objects.requireNonNull(valueTable, "valueTable");
    }
}
