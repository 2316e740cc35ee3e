package com.holdemengine.betting.rules;

import com.holdemengine.betting.BettingRoundState;
import com.holdemengine.betting.PlayerAction;
import com.holdemengine.common.ErrorCode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that only lets the player to act submit an action.
 */
@Component
@Order(2)
public class TurnOrderRule implements ActionRule {

    @Override
    public RuleResult evaluate(BettingRoundState state, PlayerAction action) {
        if (state.isComplete()) {
            return RuleResult.decline(ErrorCode.INVALID_STATE,
                "Betting round is complete");
        }
        String acting = state.getActingPlayerId();
        if (!action.getPlayerId().equals(acting)) {
            return RuleResult.decline(ErrorCode.NOT_PLAYER_TURN,
                "It is not player " + action.getPlayerId() + "'s turn to act",
                "playerId", action.getPlayerId(), "actingPlayerId", acting);
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "TurnOrder";
    }
}
