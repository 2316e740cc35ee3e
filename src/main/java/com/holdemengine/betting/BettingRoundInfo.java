package com.holdemengine.betting;

import com.holdemengine.common.ChipAmount;
import com.holdemengine.pot.Pot;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only snapshot of a betting round for display and driving logic.
 */
@Value
@Builder
public class BettingRoundInfo {

    RoundPhase phase;

    /**
     * Chips in the middle for the hand, earlier streets included.
     */
    ChipAmount potTotal;

    ChipAmount streetTotal;

    /**
     * Finalized pots; empty while the round is still running.
     */
    List<Pot> pots;

    ChipAmount currentBetLevel;

    /**
     * Minimum increment for the next full raise.
     */
    ChipAmount minRaiseSize;

    ChipAmount minRaiseTo;

    List<PlayerSnapshot> players;

    /**
     * Null when the round is complete.
     */
    String actingPlayerId;

    @Value
    public static class PlayerSnapshot {
        String playerId;
        ChipAmount stack;
        ChipAmount committed;
        boolean folded;
        boolean allIn;
        boolean pending;
    }
}
