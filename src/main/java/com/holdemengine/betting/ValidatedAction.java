package com.holdemengine.betting;

import com.holdemengine.common.ChipAmount;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * An action that passed validation, normalized against the state it was validated on.
 *
 * Instances are only created by {@link ActionValidator}. The chip movement is resolved:
 * a call carries the exact chips needed (clipped to the stack), and any action that
 * exhausts the stack is reclassified as {@link PlayerActionType#ALL_IN}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class ValidatedAction {
    String playerId;

    /**
     * Normalized type.
     */
    PlayerActionType type;

    /**
     * Type the player submitted.
     */
    PlayerActionType requestedType;

    /**
     * Chips moved from the stack into the pot.
     */
    ChipAmount chips;

    /**
     * Player's street commitment once applied.
     */
    ChipAmount committedAfter;

    boolean allIn;

    /**
     * Bet level of the state this action was validated against.
     */
    ChipAmount betLevelSeen;
}
