package com.marianbastiurea.parking.domain.policy;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.scoring.ScoringAdapter;

import java.time.Clock;
import java.util.Objects;
import java.util.Random;

/**
 * Builds a fresh policy per call. Each random policy gets its own
 * {@link Random} seeded with the configured seed.
 */
public class PolicyFactory {

    private final ScoringAdapter scoring;
    private final double blendWeight;
    private final long randomSeed;
    private final Clock clock;

    public PolicyFactory(ScoringAdapter scoring, double blendWeight, long randomSeed, Clock clock) {
        this.scoring = Objects.requireNonNull(scoring, "scoring");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.blendWeight = blendWeight;
        this.randomSeed = randomSeed;
    }

    public AllocationPolicy create(PolicyKind kind) {
        Objects.requireNonNull(kind, "kind");
        return switch (kind) {
            case LEARNED -> new LearnedPolicy(scoring, blendWeight, clock);
            case SEQUENTIAL -> new SequentialPolicy(clock);
            case RANDOM -> new RandomPolicy(new Random(randomSeed), clock);
        };
    }
}
