package com.marianbastiurea.parking.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.marianbastiurea.parking.domain.enums.DecisionStatus;
import com.marianbastiurea.parking.domain.enums.PolicyKind;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one policy invocation. Bay and slot are 1-based and only present
 * when the status is {@link DecisionStatus#ALLOCATED}.
 */
public record AllocationDecision(
        DecisionStatus status,
        Integer bayAssigned,
        Integer slotAssigned,
        Double score,
        Instant decisionTime,
        PolicyKind policy,
        String reason
) {
    public static final String NO_CAPACITY = "No free slot available";

    public AllocationDecision {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(decisionTime, "decisionTime");
        Objects.requireNonNull(policy, "policy");
        if (status == DecisionStatus.ALLOCATED && (bayAssigned == null || slotAssigned == null || score == null)) {
            throw new IllegalArgumentException("An allocated decision needs bay, slot and score");
        }
    }

    public static AllocationDecision allocated(Cell cell, double score, Instant at, PolicyKind policy) {
        return new AllocationDecision(DecisionStatus.ALLOCATED,
                cell.bayNumber(), cell.slotNumber(), score, at, policy, null);
    }

    public static AllocationDecision rejected(Instant at, PolicyKind policy) {
        return new AllocationDecision(DecisionStatus.REJECTED, null, null, null, at, policy, NO_CAPACITY);
    }

    @JsonIgnore
    public boolean isAllocated() {
        return status == DecisionStatus.ALLOCATED;
    }

    /** The chosen cell, 0-based. */
    @JsonIgnore
    public Cell cell() {
        if (!isAllocated()) {
            throw new IllegalStateException("Rejected decision has no cell");
        }
        return Cell.ofNumbers(bayAssigned, slotAssigned);
    }
}
