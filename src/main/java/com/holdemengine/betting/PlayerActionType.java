package com.holdemengine.betting;

/**
 * Kinds of action a player can take in a betting round.
 */
public enum PlayerActionType {
    FOLD,
    CHECK,
    CALL,
    BET,
    RAISE,

    /**
     * Commits the whole remaining stack. Also the normalized type of any call, bet or
     * raise that exhausts the stack.
     */
    ALL_IN;

    public boolean requiresAmount() {
        return this == BET || this == RAISE;
    }
}
