package com.holdemengine.pot;

import com.holdemengine.common.ChipAmount;
import com.holdemengine.common.ErrorCode;
import com.holdemengine.common.PokerError;
import com.holdemengine.common.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits finalized pots between winners once the showdown collaborator has ranked the
 * remaining hands.
 */
@Service
@Slf4j
public class PotDistributionService {

    /**
     * Award every pot to the best-ranked eligible players.
     *
     * @param pots finalized pots, main pot first
     * @param rankedTiers player ids grouped by hand strength, best tier first; players in
     *                    one tier tie. Order within a tier decides who receives odd chips.
     * @return payouts summing to the pot totals, or INVALID_STATE when a pot has no
     *         eligible player in any tier
     */
    public Result<List<Payout>> distribute(List<Pot> pots, List<List<String>> rankedTiers) {
        List<Payout> payouts = new ArrayList<>();
        for (int potIndex = 0; potIndex < pots.size(); potIndex++) {
            Pot pot = pots.get(potIndex);
            List<String> winners = bestEligibleTier(pot, rankedTiers);
            if (winners.isEmpty()) {
                return Result.error(PokerError.of(ErrorCode.INVALID_STATE,
                    "No ranked player is eligible for pot " + potIndex,
                    "potIndex", potIndex, "eligible", pot.getEligiblePlayerIds()));
            }
            payouts.addAll(split(pot, potIndex, winners));
        }
        log.debug("Distributed {} pot(s) as {} payout(s)", pots.size(), payouts.size());
        return Result.ok(List.copyOf(payouts));
    }

    /**
     * Award every pot to the only player left after everyone else folded.
     */
    public Result<List<Payout>> awardUncontested(List<Pot> pots, String playerId) {
        List<Payout> payouts = new ArrayList<>();
        for (int potIndex = 0; potIndex < pots.size(); potIndex++) {
            Pot pot = pots.get(potIndex);
            if (!pot.isEligible(playerId)) {
                return Result.error(PokerError.of(ErrorCode.INVALID_STATE,
                    "Player " + playerId + " is not eligible for pot " + potIndex,
                    "potIndex", potIndex, "playerId", playerId));
            }
            payouts.add(new Payout(playerId, pot.getAmount(), potIndex));
        }
        return Result.ok(List.copyOf(payouts));
    }

    private List<String> bestEligibleTier(Pot pot, List<List<String>> rankedTiers) {
        for (List<String> tier : rankedTiers) {
            List<String> eligible = tier.stream().filter(pot::isEligible).toList();
            if (!eligible.isEmpty()) {
                return eligible;
            }
        }
        return List.of();
    }

    private List<Payout> split(Pot pot, int potIndex, List<String> winners) {
        int count = winners.size();
        ChipAmount share = pot.getAmount().divide(count);
        long oddChips = pot.getAmount().remainder(count).getAmount().longValueExact();

        List<Payout> payouts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ChipAmount amount = i < oddChips ? share.add(ChipAmount.of(1)) : share;
            payouts.add(new Payout(winners.get(i), amount, potIndex));
        }
        return payouts;
    }
}
