package com.holdemengine.betting;

import com.holdemengine.common.ChipAmount;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable per-player state within one betting round.
 */
@Value
@Builder(toBuilder = true)
public class BettingRoundPlayerState {

    String playerId;

    /**
     * Chips behind, not yet committed.
     */
    ChipAmount stack;

    /**
     * Chips committed on this street, including posted blinds and antes.
     */
    @Builder.Default
    ChipAmount committed = ChipAmount.zero();

    /**
     * Chips put in on earlier streets of the same hand.
     */
    @Builder.Default
    ChipAmount priorContribution = ChipAmount.zero();

    boolean folded;

    boolean allIn;

    /**
     * Whether the player has acted since the last full bet or raise. Such a player facing
     * only a short all-in may call or fold, not raise.
     */
    boolean acted;

    public static BettingRoundPlayerState seated(String playerId, long stack) {
        return BettingRoundPlayerState.builder()
            .playerId(playerId)
            .stack(ChipAmount.of(stack))
            .build();
    }

    /**
     * A player who already moved {@code posted} chips from their stack (blind or ante).
     *
     * @param stack chips remaining behind after posting
     */
    public static BettingRoundPlayerState posted(String playerId, long stack, long posted) {
        return BettingRoundPlayerState.builder()
            .playerId(playerId)
            .stack(ChipAmount.of(stack))
            .committed(ChipAmount.of(posted))
            .build();
    }

    /**
     * Still has chips and a live hand.
     */
    public boolean canAct() {
        return !folded && !allIn && stack.isPositive();
    }

    /**
     * Total put in this hand: earlier streets plus this one.
     */
    public ChipAmount handContribution() {
        return priorContribution.add(committed);
    }
}
