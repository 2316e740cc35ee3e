package com.holdemengine.pot;

import com.holdemengine.common.ChipAmount;
import lombok.Value;

import java.util.List;

/**
 * A main or side pot with the players eligible to win it.
 */
@Value
public class Pot {

    ChipAmount amount;

    /**
     * Eligible players in table order.
     */
    List<String> eligiblePlayerIds;

    /**
     * Top layer only one player put chips into: nobody matched them.
     */
    boolean uncalled;

    public boolean isEligible(String playerId) {
        return eligiblePlayerIds.contains(playerId);
    }
}
