package com.holdemengine.betting.rules;

import com.holdemengine.betting.BettingRoundState;
import com.holdemengine.betting.PlayerAction;
import com.holdemengine.common.ErrorCode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that rejects actions from players who are not part of the round.
 */
@Component
@Order(1)
public class PlayerPresenceRule implements ActionRule {

    @Override
    public RuleResult evaluate(BettingRoundState state, PlayerAction action) {
        if (state.findPlayer(action.getPlayerId()).isEmpty()) {
            return RuleResult.decline(ErrorCode.PLAYER_NOT_FOUND,
                "Player " + action.getPlayerId() + " is not in this betting round",
                "playerId", action.getPlayerId());
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "PlayerPresence";
    }
}
