package com.holdemengine.betting;

import com.holdemengine.common.ChipAmount;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Pure legality computations for a player in a given round state.
 *
 * Turn order is deliberately not considered here, so the result can be shown for any
 * seat; out-of-turn submissions are rejected by the validation chain.
 */
public final class ActionLegality {

    private ActionLegality() {
    }

    public static AvailableActions available(BettingRoundState state, BettingRoundPlayerState player) {
        if (player.isFolded() || player.isAllIn() || !player.getStack().isPositive()) {
            return AvailableActions.none();
        }

        ChipAmount betLevel = state.getBetLevel();
        ChipAmount owed = amountOwed(state, player);
        ChipAmount maxTo = maxTotal(player);

        boolean raiseClosed = isRaiseClosed(state, player);

        Set<PlayerActionType> types = EnumSet.of(PlayerActionType.FOLD);
        if (owed.isZero()) {
            types.add(PlayerActionType.CHECK);
        } else {
            types.add(PlayerActionType.CALL);
        }
        if (betLevel.isZero()) {
            types.add(PlayerActionType.BET);
        } else if (!raiseClosed && maxTo.isGreaterThan(betLevel)) {
            types.add(PlayerActionType.RAISE);
        }
        // With raising closed, going all-in is only legal as a call.
        if (!raiseClosed || !player.getStack().isGreaterThan(owed)) {
            types.add(PlayerActionType.ALL_IN);
        }

        boolean canBet = types.contains(PlayerActionType.BET);
        boolean canRaise = types.contains(PlayerActionType.RAISE);
        return AvailableActions.builder()
            .types(Collections.unmodifiableSet(types))
            .callAmount(ChipAmount.min(owed, player.getStack()))
            .minBetTo(canBet ? ChipAmount.min(state.getMinBet(), maxTo) : ChipAmount.zero())
            .maxBetTo(canBet ? maxTo : ChipAmount.zero())
            .minRaiseTo(canRaise ? ChipAmount.min(state.minRaiseTo(), maxTo) : ChipAmount.zero())
            .maxRaiseTo(canRaise ? maxTo : ChipAmount.zero())
            .build();
    }

    /**
     * True when the player already acted at this street's last full bet or raise and the
     * level has since only moved by a short all-in.
     */
    public static boolean isRaiseClosed(BettingRoundState state, BettingRoundPlayerState player) {
        return player.isActed() && state.getBetLevel().isPositive();
    }

    /**
     * Chips still needed to match the bet level, not clipped to the stack.
     */
    public static ChipAmount amountOwed(BettingRoundState state, BettingRoundPlayerState player) {
        ChipAmount owed = state.getBetLevel().subtract(player.getCommitted());
        return owed.isPositive() ? owed : ChipAmount.zero();
    }

    /**
     * Largest street total the player can reach: everything behind plus what is in.
     */
    public static ChipAmount maxTotal(BettingRoundPlayerState player) {
        return player.getStack().add(player.getCommitted());
    }
}
