package com.marianbastiurea.parking.domain.enums;

import java.util.Locale;

public enum PolicyKind {
    LEARNED,
    SEQUENTIAL,
    RANDOM;

    /** Accepts the enum name in any case, plus {@code algorithm} as an alias of {@link #LEARNED}. */
    public static PolicyKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Strategy name is required");
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        return switch (n) {
            case "learned", "algorithm" -> LEARNED;
            case "sequential" -> SEQUENTIAL;
            case "random" -> RANDOM;
            default -> throw new IllegalArgumentException(
                    "Invalid strategy '" + name + "'. Must be 'algorithm', 'learned', 'sequential' or 'random'");
        };
    }
}
