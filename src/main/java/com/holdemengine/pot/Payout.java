package com.holdemengine.pot;

import com.holdemengine.common.ChipAmount;
import lombok.Value;

/**
 * Chips awarded to one player from one pot.
 */
@Value
public class Payout {
    String playerId;
    ChipAmount amount;
    int potIndex;
}
