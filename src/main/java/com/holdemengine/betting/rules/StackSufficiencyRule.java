package com.holdemengine.betting.rules;

import com.holdemengine.betting.ActionLegality;
import com.holdemengine.betting.BettingRoundPlayerState;
import com.holdemengine.betting.BettingRoundState;
import com.holdemengine.betting.PlayerAction;
import com.holdemengine.common.ChipAmount;
import com.holdemengine.common.ErrorCode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that rejects bets and raises the player's stack cannot cover.
 */
@Component
@Order(5)
public class StackSufficiencyRule implements ActionRule {

    @Override
    public RuleResult evaluate(BettingRoundState state, PlayerAction action) {
        if (!action.getType().requiresAmount()) {
            return RuleResult.approve();
        }
        BettingRoundPlayerState player = state.findPlayer(action.getPlayerId()).orElseThrow();
        ChipAmount maxTo = ActionLegality.maxTotal(player);
        if (action.getAmount().isGreaterThan(maxTo)) {
            ChipAmount required = action.getAmount().subtract(player.getCommitted());
            return RuleResult.decline(ErrorCode.INSUFFICIENT_STACK,
                String.format("Player %s has %s behind but %s to %s needs %s",
                    player.getPlayerId(), player.getStack(), action.getType(), action.getAmount(), required),
                "required", required, "available", player.getStack());
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "StackSufficiency";
    }
}
