package com.holdemengine.betting;

import com.holdemengine.common.ChipAmount;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * Action proposed by a player.
 *
 * Only bets and raises carry an amount, and that amount is the total the player will
 * have committed on this street once the action is applied ("bet to", "raise to").
 * Calls and all-ins derive their chips from the round state.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PlayerAction {
    String playerId;
    PlayerActionType type;
    ChipAmount amount;

    public static PlayerAction fold(String playerId) {
        return new PlayerAction(requireId(playerId), PlayerActionType.FOLD, null);
    }

    public static PlayerAction check(String playerId) {
        return new PlayerAction(requireId(playerId), PlayerActionType.CHECK, null);
    }

    public static PlayerAction call(String playerId) {
        return new PlayerAction(requireId(playerId), PlayerActionType.CALL, null);
    }

    public static PlayerAction allIn(String playerId) {
        return new PlayerAction(requireId(playerId), PlayerActionType.ALL_IN, null);
    }

    public static PlayerAction bet(String playerId, ChipAmount betTo) {
        return new PlayerAction(requireId(playerId), PlayerActionType.BET,
            Objects.requireNonNull(betTo, "Bet amount is required"));
    }

    public static PlayerAction bet(String playerId, long betTo) {
        return bet(playerId, ChipAmount.of(betTo));
    }

    public static PlayerAction raise(String playerId, ChipAmount raiseTo) {
        return new PlayerAction(requireId(playerId), PlayerActionType.RAISE,
            Objects.requireNonNull(raiseTo, "Raise amount is required"));
    }

    public static PlayerAction raise(String playerId, long raiseTo) {
        return raise(playerId, ChipAmount.of(raiseTo));
    }

    private static String requireId(String playerId) {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("Player id cannot be blank");
        }
        return playerId;
    }
}
