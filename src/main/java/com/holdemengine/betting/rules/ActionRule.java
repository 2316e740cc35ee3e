package com.holdemengine.betting.rules;

import com.holdemengine.betting.BettingRoundState;
import com.holdemengine.betting.PlayerAction;

/**
 * A single check in the action validation chain.
 *
 * Rules run in their declared order and the first decline rejects the action, so a
 * rule may rely on every earlier rule having approved (e.g. that the player exists).
 */
public interface ActionRule {

    /**
     * Evaluate the rule against a proposed action.
     *
     * @param state the round state the action would be applied to
     * @param action the proposed action
     * @return the result of the rule evaluation
     */
    RuleResult evaluate(BettingRoundState state, PlayerAction action);

    /**
     * Get the name of this rule.
     */
    String getRuleName();
}
