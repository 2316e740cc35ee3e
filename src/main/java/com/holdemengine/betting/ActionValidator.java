package com.holdemengine.betting;

import com.holdemengine.betting.rules.ActionRule;
import com.holdemengine.betting.rules.RuleResult;
import com.holdemengine.common.ChipAmount;
import com.holdemengine.common.Result;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides which actions a player may take and validates proposed actions.
 *
 * Validation runs the ordered {@link ActionRule} chain: player presence, turn order,
 * action legality, amount bounds, stack sufficiency. The first rule that declines
 * rejects the action. An approved action is normalized into a {@link ValidatedAction}
 * ready for {@link BettingRoundEngine#applyActionToBettingRound}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionValidator {

    private final List<ActionRule> rules;

    /**
     * Actions the player could take if it were their turn.
     *
     * @return the legal types and bounds; empty for folded, all-in or unknown players
     */
    public AvailableActions getAvailableActions(BettingRoundState state, String playerId) {
        return state.findPlayer(playerId)
            .map(player -> ActionLegality.available(state, player))
            .orElseGet(AvailableActions::none);
    }

    /**
     * Validate a proposed action against the round state. Never changes the state.
     *
     * @return the normalized action, or the error of the first rule that declined it
     */
    public Result<ValidatedAction> validateAction(BettingRoundState state, PlayerAction action) {
        log.debug("Evaluating {} rules for {} by {}", rules.size(), action.getType(), action.getPlayerId());

        for (ActionRule rule : rules) {
            RuleResult result = rule.evaluate(state, action);

            if (!result.isApproved()) {
                log.debug("Rule {} declined {} by {}: {}", rule.getRuleName(),
                    action.getType(), action.getPlayerId(), result.getError().getMessage());
                return result.toResult();
            }
        }

        BettingRoundPlayerState player = state.findPlayer(action.getPlayerId()).orElseThrow();
        return Result.ok(normalize(state, player, action));
    }

    private ValidatedAction normalize(BettingRoundState state, BettingRoundPlayerState player, PlayerAction action) {
        ChipAmount committed = player.getCommitted();
        ChipAmount chips;
        switch (action.getType()) {
            case FOLD:
            case CHECK:
                chips = ChipAmount.zero();
                break;
            case CALL:
                chips = ChipAmount.min(ActionLegality.amountOwed(state, player), player.getStack());
                break;
            case BET:
            case RAISE:
                chips = action.getAmount().subtract(committed);
                break;
            case ALL_IN:
                chips = player.getStack();
                break;
            default:
                throw new IllegalArgumentException("Unknown action type: " + action.getType());
        }

        boolean allIn = chips.isPositive() && chips.equals(player.getStack());
        PlayerActionType type = allIn ? PlayerActionType.ALL_IN : action.getType();
        return new ValidatedAction(
            player.getPlayerId(),
            type,
            action.getType(),
            chips,
            committed.add(chips),
            allIn,
            state.getBetLevel()
        );
    }
}
