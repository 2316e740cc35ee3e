package com.holdemengine.pot;

import com.holdemengine.betting.BettingRoundPlayerState;
import com.holdemengine.common.ChipAmount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Builds the main pot and side pots from the full contribution ledger of a hand.
 *
 * Pots are layered by the contribution levels of live (non-folded) players: each layer
 * takes, from every contributor, the part of their contribution between the previous
 * level and this one, and is eligible to the live players who reached it. Folded
 * players feed the layers but are eligible for none.
 */
@Component
@Slf4j
public class PotCalculator {

    public List<Pot> computePots(List<BettingRoundPlayerState> players) {
        TreeSet<ChipAmount> levels = new TreeSet<>();
        long livePlayers = 0;
        for (BettingRoundPlayerState player : players) {
            if (!player.isFolded()) {
                livePlayers++;
                if (player.handContribution().isPositive()) {
                    levels.add(player.handContribution());
                }
            }
        }

        ChipAmount total = ChipAmount.sum(players.stream().map(BettingRoundPlayerState::handContribution).toList());
        if (total.isZero()) {
            return List.of();
        }
        if (levels.isEmpty()) {
            // Live players put nothing in; whatever is there goes to whoever is live.
            return List.of(new Pot(total, liveIds(players), false));
        }

        List<ChipAmount> amounts = new ArrayList<>();
        List<List<String>> eligibility = new ArrayList<>();
        List<ChipAmount> floors = new ArrayList<>();
        ChipAmount previous = ChipAmount.zero();
        for (ChipAmount level : levels) {
            ChipAmount layer = ChipAmount.zero();
            List<String> eligible = new ArrayList<>();
            for (BettingRoundPlayerState player : players) {
                ChipAmount contribution = player.handContribution();
                layer = layer.add(ChipAmount.min(contribution, level)
                    .subtract(ChipAmount.min(contribution, previous)));
                if (!player.isFolded() && contribution.isGreaterThanOrEqual(level)) {
                    eligible.add(player.getPlayerId());
                }
            }
            mergeOrAppend(amounts, eligibility, floors, layer, eligible, previous);
            previous = level;
        }

        // Folded chips above the highest live level stay with the top pot.
        ChipAmount top = levels.last();
        ChipAmount overflow = ChipAmount.zero();
        for (BettingRoundPlayerState player : players) {
            ChipAmount contribution = player.handContribution();
            if (contribution.isGreaterThan(top)) {
                overflow = overflow.add(contribution.subtract(top));
            }
        }
        int last = amounts.size() - 1;
        amounts.set(last, amounts.get(last).add(overflow));

        List<Pot> pots = new ArrayList<>();
        for (int i = 0; i < amounts.size(); i++) {
            List<String> eligible = eligibility.get(i);
            boolean uncalled = i == last && livePlayers > 1 && eligible.size() == 1
                && onlyContributorAbove(players, eligible.get(0), floors.get(i));
            pots.add(new Pot(amounts.get(i), List.copyOf(eligible), uncalled));
        }

        log.debug("Built {} pot(s) totalling {} from {} contributors", pots.size(), total, players.size());
        return List.copyOf(pots);
    }

    private void mergeOrAppend(List<ChipAmount> amounts, List<List<String>> eligibility, List<ChipAmount> floors,
                               ChipAmount layer, List<String> eligible, ChipAmount floor) {
        int last = amounts.size() - 1;
        if (last >= 0 && eligibility.get(last).equals(eligible)) {
            amounts.set(last, amounts.get(last).add(layer));
        } else {
            amounts.add(layer);
            eligibility.add(eligible);
            floors.add(floor);
        }
    }

    private boolean onlyContributorAbove(List<BettingRoundPlayerState> players, String playerId, ChipAmount floor) {
        return players.stream()
            .filter(p -> !p.getPlayerId().equals(playerId))
            .noneMatch(p -> p.handContribution().isGreaterThan(floor));
    }

    private List<String> liveIds(List<BettingRoundPlayerState> players) {
        return players.stream()
            .filter(p -> !p.isFolded())
            .map(BettingRoundPlayerState::getPlayerId)
            .toList();
    }
}
