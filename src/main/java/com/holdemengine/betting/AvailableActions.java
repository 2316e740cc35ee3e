package com.holdemengine.betting;

import com.holdemengine.common.ChipAmount;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Legal action types for a player, with the amount bounds that apply to them.
 * Bounds are street totals ("to" amounts); they are zero when the type is not legal.
 */
@Value
@Builder
public class AvailableActions {

    Set<PlayerActionType> types;

    /**
     * Chips a call moves from the stack, already clipped to the stack.
     */
    ChipAmount callAmount;

    ChipAmount minBetTo;

    ChipAmount maxBetTo;

    ChipAmount minRaiseTo;

    ChipAmount maxRaiseTo;

    public static AvailableActions none() {
        return AvailableActions.builder()
            .types(Collections.unmodifiableSet(EnumSet.noneOf(PlayerActionType.class)))
            .callAmount(ChipAmount.zero())
            .minBetTo(ChipAmount.zero())
            .maxBetTo(ChipAmount.zero())
            .minRaiseTo(ChipAmount.zero())
            .maxRaiseTo(ChipAmount.zero())
            .build();
    }

    public boolean contains(PlayerActionType type) {
        return types.contains(type);
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }
}
