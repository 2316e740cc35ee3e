package com.holdemengine.betting;

/**
 * Lifecycle of a single betting round.
 */
public enum RoundPhase {
    /**
     * At least one player still owes an action.
     */
    AWAITING_ACTION,

    /**
     * No further action is possible on this street.
     */
    COMPLETE
}
