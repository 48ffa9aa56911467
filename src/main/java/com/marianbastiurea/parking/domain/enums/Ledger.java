package com.marianbastiurea.parking.domain.enums;

import java.util.Locale;

/**
 * Partition of the allocation store. MAIN holds live allocations; the other
 * ledgers hold the committed results of the latest simulation of one policy.
 */
public enum Ledger {
    MAIN,
    LEARNED,
    SEQUENTIAL,
    RANDOM;

    public static Ledger forPolicy(PolicyKind kind) {
        return switch (kind) {
            case LEARNED -> LEARNED;
            case SEQUENTIAL -> SEQUENTIAL;
            case RANDOM -> RANDOM;
        };
    }

    public static Ledger fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Ledger name is required");
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        if (n.equals("main")) return MAIN;
        return forPolicy(PolicyKind.fromName(n));
    }
}
