package com.holdemengine.betting;

import com.holdemengine.common.ChipAmount;
import lombok.Builder;
import lombok.Value;

/**
 * Per-street configuration supplied by the table layer.
 */
@Value
@Builder
public class RoundConfig {

    ChipAmount bigBlind;

    /**
     * Smallest opening bet; the big blind when not set.
     */
    ChipAmount minBet;

    /**
     * Player the caller's ordering rule puts first to act. When null, action starts at
     * the first eligible player in table order.
     */
    String firstToActPlayerId;

    public ChipAmount effectiveMinBet() {
        return minBet != null ? minBet : bigBlind;
    }
}
