package com.tessera.funnel;

/**
 * Progress state of a single entity through a funnel
 */
public enum FunnelState {
    AWAITING_STEP,
    COMPLETED,
    EXPIRED;

    public boolean isTerminal() {
        return this != AWAITING_STEP;
    }
}
