package com.holdemengine.betting;

import com.holdemengine.common.ChipAmount;
import lombok.Value;

/**
 * Immutable record of one applied action. The action log of a round is append-only.
 */
@Value
public class ActionLogEntry {
    int sequence;
    String playerId;
    PlayerActionType type;
    ChipAmount chips;
    ChipAmount committedAfter;
    ChipAmount betLevelAfter;
}
