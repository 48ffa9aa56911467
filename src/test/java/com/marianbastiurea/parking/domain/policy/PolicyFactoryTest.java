package com.marianbastiurea.parking.domain.policy;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.grid.OccupancyGrid;
import com.marianbastiurea.parking.domain.model.Facility;
import org.junit.jupiter.api.Test;

import static com.marianbastiurea.parking.support.Vehicles.*;
import static org.junit.jupiter.api.Assertions.*;

class PolicyFactoryTest {

    private final PolicyFactory factory = new PolicyFactory(constantScoring(1.0, 0.0), 0.3, 42L, CLOCK);

    @Test
    void createsOnePolicyPerKind() {
        assertInstanceOf(LearnedPolicy.class, factory.create(PolicyKind.LEARNED));
        assertInstanceOf(SequentialPolicy.class, factory.create(PolicyKind.SEQUENTIAL));
        assertInstanceOf(RandomPolicy.class, factory.create(PolicyKind.RANDOM));
        for (PolicyKind kind : PolicyKind.values()) {
            assertEquals(kind, factory.create(kind).kind());
        }
    }

    @Test
    void eachRandomPolicyStartsFromTheConfiguredSeed() {
        Facility facility = new Facility(4, 10);
        AllocationPolicy first = factory.create(PolicyKind.RANDOM);
        AllocationPolicy second = factory.create(PolicyKind.RANDOM);

        assertEquals(
                first.decide(vehicle("A"), new OccupancyGrid(facility, 7L, CLOCK)).cell(),
                second.decide(vehicle("A"), new OccupancyGrid(facility, 7L, CLOCK)).cell());
    }
}
