package com.delta.autoapply.apply.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum ApplicationSessionStatus {
    PENDING,
    READY_FOR_REVIEW,
    APPROVED,
    SUBMITTING,
    SUBMITTED,
    FAILED,
    CANCELLED;

    private static final Map<ApplicationSessionStatus, Set<ApplicationSessionStatus>> LEGAL_EDGES =
        new EnumMap<>(ApplicationSessionStatus.class);

    static {
        for (ApplicationSessionStatus status : values()) {
            LEGAL_EDGES.put(status, EnumSet.noneOf(ApplicationSessionStatus.class));
        }
        LEGAL_EDGES.get(PENDING).addAll(EnumSet.of(READY_FOR_REVIEW, FAILED));
        LEGAL_EDGES.get(READY_FOR_REVIEW).addAll(EnumSet.of(APPROVED, CANCELLED));
        LEGAL_EDGES.get(APPROVED).add(SUBMITTING);
        LEGAL_EDGES.get(SUBMITTING).addAll(EnumSet.of(SUBMITTED, FAILED));
    }

    public boolean canTransitionTo(ApplicationSessionStatus target) {
        return target != null && LEGAL_EDGES.get(this).contains(target);
    }

    public boolean isTerminal() {
        return this == SUBMITTED || this == FAILED || this == CANCELLED;
    }

    /**
     * Message, answers and AI metadata may only change in these states.
     */
    public boolean allowsEdits() {
        return this == PENDING || this == READY_FOR_REVIEW;
    }
}
