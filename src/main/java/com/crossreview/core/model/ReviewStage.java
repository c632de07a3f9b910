package com.crossreview.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a review session.
 * <p>
 * The happy path is strictly linear. {@link #FAILED} and {@link #CANCELLED} are reachable
 * from every non-terminal stage; {@link #COMPLETED} may only be followed by cancellation
 * (caller-driven cleanup).
 */
public enum ReviewStage {
    CREATED,
    CLASSIFYING,
    AWAITING_CONFIRMATION,
    REVIEWING_LOW_RISK,
    REVIEWING_HIGH_RISK,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(ReviewStage next) {
        if (next == CANCELLED) {
            return this != CANCELLED;
        }
        if (next == FAILED) {
            return !isTerminal();
        }
        return successors().contains(next);
    }

    private Set<ReviewStage> successors() {
        return switch (this) {
            case CREATED -> EnumSet.of(CLASSIFYING);
            case CLASSIFYING -> EnumSet.of(AWAITING_CONFIRMATION);
            case AWAITING_CONFIRMATION -> EnumSet.of(REVIEWING_LOW_RISK);
            // no high-risk files: low-risk review finishes the session
            case REVIEWING_LOW_RISK -> EnumSet.of(REVIEWING_HIGH_RISK, COMPLETED);
            case REVIEWING_HIGH_RISK -> EnumSet.of(COMPLETED);
            default -> EnumSet.noneOf(ReviewStage.class);
        };
    }
}
