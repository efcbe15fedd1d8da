package com.di.bidshub.upload.stage;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one shard inside a run.
 *
 * <pre>
 * PENDING → ASSEMBLING → TRANSMITTING → COMMITTED
 *              │   ↺          │   ↺
 *              └─────→ FAILED ←┘
 * </pre>
 *
 * A retry re-enters the state it failed in. Cancellation returns an uncommitted shard to
 * {@code PENDING} so the next run picks it up.
 */
public enum ShardState {

    PENDING,
    ASSEMBLING,
    TRANSMITTING,
    COMMITTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED;
    }

    public boolean canTransitionTo(ShardState next) {
        return allowedFrom(this).contains(next);
    }

    /**
     * @throws IllegalStateException on a transition the lifecycle does not allow
     */
    public ShardState transitionTo(ShardState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal shard transition " + this + " → " + next);
        }
        return next;
    }

    private static Set<ShardState> allowedFrom(ShardState state) {
        return switch (state) {
            case PENDING      -> EnumSet.of(ASSEMBLING);
            case ASSEMBLING   -> EnumSet.of(ASSEMBLING, TRANSMITTING, FAILED, PENDING);
            case TRANSMITTING -> EnumSet.of(TRANSMITTING, COMMITTED, FAILED, PENDING);
            case COMMITTED, FAILED -> EnumSet.noneOf(ShardState.class);
        };
    }
}
