package com.marianbastiurea.parking.domain.model;

/** Model inputs derived from a request and the current grid. */
public record FeatureVector(
        double durationHours,
        int dayOfWeek,
        int hourOfDay,
        int priorityLevel,
        double occupancyRatio
) {
    public double get(Feature feature) {
        return switch (feature) {
            case DURATION_HOURS -> durationHours;
            case DAY_OF_WEEK -> dayOfWeek;
            case HOUR_OF_DAY -> hourOfDay;
            case PRIORITY_LEVEL -> priorityLevel;
            case OCCUPANCY_RATIO -> occupancyRatio;
        };
    }

    public enum Feature {
        DURATION_HOURS("durationHours"),
        DAY_OF_WEEK("dayOfWeek"),
        HOUR_OF_DAY("hourOfDay"),
        PRIORITY_LEVEL("priorityLevel"),
        OCCUPANCY_RATIO("occupancyRatio");

        private final String key;

        Feature(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        public static Feature fromKey(String key) {
            for (Feature f : values()) {
                if (f.key.equals(key)) return f;
            }
            throw new IllegalArgumentException("Unknown feature: " + key);
        }
    }
}
