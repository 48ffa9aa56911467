package com.marianbastiurea.parking.domain.scoring;

import com.marianbastiurea.parking.domain.model.FeatureVector;

/**
 * Time-aware state: occupancy bucket times 24 plus the arrival hour.
 */
public final class StateDiscretizer {

    public static final int HOURS = 24;

    private final int occupancyBuckets;

    public StateDiscretizer(int occupancyBuckets) {
        if (occupancyBuckets < 1) {
            throw new IllegalArgumentException("occupancyBuckets must be >= 1");
        }
        this.occupancyBuckets = occupancyBuckets;
    }

    public int stateCount() {
        return occupancyBuckets * HOURS;
    }

    public int bucket(double occupancyRatio) {
        int b = (int) Math.floor(occupancyRatio * occupancyBuckets);
        return Math.max(0, Math.min(occupancyBuckets - 1, b));
    }

    public int state(FeatureVector features) {
        int hour = Math.max(0, Math.min(HOURS - 1, features.hourOfDay()));
        return bucket(features.occupancyRatio()) * HOURS + hour;
    }
}
