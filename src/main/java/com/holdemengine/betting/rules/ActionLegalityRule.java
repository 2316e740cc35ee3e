package com.holdemengine.betting.rules;

import com.holdemengine.betting.ActionLegality;
import com.holdemengine.betting.AvailableActions;
import com.holdemengine.betting.BettingRoundPlayerState;
import com.holdemengine.betting.BettingRoundState;
import com.holdemengine.betting.PlayerAction;
import com.holdemengine.common.ErrorCode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that rejects action types the player may not choose in the current state.
 */
@Component
@Order(3)
public class ActionLegalityRule implements ActionRule {

    @Override
    public RuleResult evaluate(BettingRoundState state, PlayerAction action) {
        BettingRoundPlayerState player = state.findPlayer(action.getPlayerId()).orElseThrow();
        AvailableActions available = ActionLegality.available(state, player);

        if (available.contains(action.getType())) {
            return RuleResult.approve();
        }
        return RuleResult.decline(ErrorCode.INVALID_ACTION, reason(state, player, action),
            "type", action.getType(), "available", available.getTypes());
    }

    private String reason(BettingRoundState state, BettingRoundPlayerState player, PlayerAction action) {
        if (player.isFolded()) {
            return "Player " + player.getPlayerId() + " has folded";
        }
        if (player.isAllIn() || !player.getStack().isPositive()) {
            return "Player " + player.getPlayerId() + " is all-in";
        }
        boolean raiseClosed = ActionLegality.isRaiseClosed(state, player);
        switch (action.getType()) {
            case CHECK:
                return "Cannot CHECK facing " + ActionLegality.amountOwed(state, player) + " to call";
            case CALL:
                return "Cannot CALL when there is no bet to call";
            case BET:
                return "Cannot BET when the bet level is already " + state.getBetLevel();
            case RAISE:
                if (raiseClosed) {
                    return "Player " + player.getPlayerId() + " faces only a short all-in since acting and may CALL or FOLD";
                }
                return state.getBetLevel().isZero()
                    ? "Cannot RAISE when there is no bet to raise"
                    : "Cannot RAISE, stack does not cover more than the bet level";
            case ALL_IN:
                return "Player " + player.getPlayerId() + " faces only a short all-in since acting and cannot go all-in for more than the call";
            default:
                return action.getType() + " is not available";
        }
    }

    @Override
    public String getRuleName() {
        return "ActionLegality";
    }
}
