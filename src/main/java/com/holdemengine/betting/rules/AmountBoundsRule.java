package com.holdemengine.betting.rules;

import com.holdemengine.betting.ActionLegality;
import com.holdemengine.betting.BettingRoundPlayerState;
import com.holdemengine.betting.BettingRoundState;
import com.holdemengine.betting.PlayerAction;
import com.holdemengine.betting.PlayerActionType;
import com.holdemengine.common.ChipAmount;
import com.holdemengine.common.ErrorCode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rule that enforces minimum bet and minimum raise sizes.
 *
 * A bet or raise to the player's whole stack is always accepted. Amounts above the
 * stack are left to {@link StackSufficiencyRule}.
 */
@Component
@Order(4)
public class AmountBoundsRule implements ActionRule {

    @Override
    public RuleResult evaluate(BettingRoundState state, PlayerAction action) {
        if (!action.getType().requiresAmount()) {
            return RuleResult.approve();
        }
        BettingRoundPlayerState player = state.findPlayer(action.getPlayerId()).orElseThrow();
        ChipAmount amount = action.getAmount();
        ChipAmount maxTo = ActionLegality.maxTotal(player);

        if (action.getType() == PlayerActionType.BET) {
            if (!amount.isPositive()) {
                return decline(ErrorCode.INVALID_BET_AMOUNT,
                    "BET amount must be greater than 0", amount, state.getMinBet());
            }
            if (amount.isLessThan(state.getMinBet()) && !amount.equals(maxTo)) {
                return decline(ErrorCode.INVALID_BET_AMOUNT,
                    "BET to " + amount + " is below the minimum bet of " + state.getMinBet(),
                    amount, state.getMinBet());
            }
            return RuleResult.approve();
        }

        if (!amount.isGreaterThan(state.getBetLevel())) {
            return decline(ErrorCode.INVALID_RAISE_AMOUNT,
                "RAISE to " + amount + " does not exceed the bet level of " + state.getBetLevel(),
                amount, state.minRaiseTo());
        }
        if (amount.isLessThan(state.minRaiseTo()) && !amount.equals(maxTo)) {
            return decline(ErrorCode.INVALID_RAISE_AMOUNT,
                "RAISE to " + amount + " is below the minimum raise to " + state.minRaiseTo(),
                amount, state.minRaiseTo());
        }
        return RuleResult.approve();
    }

    private RuleResult decline(ErrorCode code, String message, ChipAmount amount, ChipAmount minimum) {
        return RuleResult.decline(code, message, "amount", amount, "minimum", minimum);
    }

    @Override
    public String getRuleName() {
        return "AmountBounds";
    }
}
