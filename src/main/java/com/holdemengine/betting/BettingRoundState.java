package com.holdemengine.betting;

import com.holdemengine.common.ChipAmount;
import com.holdemengine.pot.Pot;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable state of one street of betting.
 *
 * Every transition in {@link BettingRoundEngine} produces a new instance; an instance
 * is never modified after it is built. Collections held here are unmodifiable.
 */
@Value
@Builder(toBuilder = true)
public class BettingRoundState {

    /**
     * Players in table (action) order.
     */
    List<BettingRoundPlayerState> players;

    /**
     * Index into {@link #players} of the player to act, or null once complete.
     */
    Integer actorIndex;

    /**
     * Highest street commitment of any player.
     */
    ChipAmount betLevel;

    /**
     * Size of the last full bet or raise; the big blind until one happens.
     */
    ChipAmount lastRaiseSize;

    ChipAmount bigBlind;

    ChipAmount minBet;

    /**
     * Ids of players who still owe an action, in table order.
     */
    Set<String> pendingPlayerIds;

    RoundPhase phase;

    /**
     * Main pot first, then side pots. Empty until the round completes.
     */
    List<Pot> pots;

    List<ActionLogEntry> actionLog;

    public boolean isComplete() {
        return phase == RoundPhase.COMPLETE;
    }

    public Optional<BettingRoundPlayerState> findPlayer(String playerId) {
        return players.stream()
            .filter(p -> p.getPlayerId().equals(playerId))
            .findFirst();
    }

    /**
     * @return id of the player to act, or null once complete
     */
    public String getActingPlayerId() {
        return actorIndex == null ? null : players.get(actorIndex).getPlayerId();
    }

    /**
     * Smallest legal "raise to" total, ignoring the all-in exception.
     */
    public ChipAmount minRaiseTo() {
        return betLevel.add(lastRaiseSize);
    }

    public long countLivePlayers() {
        return players.stream().filter(p -> !p.isFolded()).count();
    }

    /**
     * Chips committed on this street by all players, folded ones included.
     */
    public ChipAmount streetTotal() {
        return ChipAmount.sum(players.stream().map(BettingRoundPlayerState::getCommitted).toList());
    }

    /**
     * Chips in the middle for the whole hand so far.
     */
    public ChipAmount potTotal() {
        return ChipAmount.sum(players.stream().map(BettingRoundPlayerState::handContribution).toList());
    }

    /**
     * Stacks plus street commitments. Constant across a round.
     */
    public ChipAmount chipsInPlay() {
        return ChipAmount.sum(players.stream().map(p -> p.getStack().add(p.getCommitted())).toList());
    }
}
