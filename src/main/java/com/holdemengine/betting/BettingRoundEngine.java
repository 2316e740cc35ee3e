package com.holdemengine.betting;

import com.holdemengine.common.ChipAmount;
import com.holdemengine.common.ErrorCode;
import com.holdemengine.common.PokerError;
import com.holdemengine.common.Result;
import com.holdemengine.common.exception.PokerEngineException;
import com.holdemengine.pot.PotCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * State machine for one street of betting.
 *
 * Round flow:
 * 1. Start from the players' posted amounts and the caller's first actor
 * 2. Validate each submitted action against the current state
 * 3. Apply it, producing a new state (chips, bet level, who still owes action)
 * 4. Advance to the next player who owes action, or complete the round
 * 5. On completion, finalize main and side pots from the contribution ledger
 *
 * States are immutable; a rejected action leaves the caller's state untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BettingRoundEngine {

    private final ActionValidator actionValidator;
    private final PotCalculator potCalculator;

    /**
     * Start a betting round.
     *
     * @param players players in table order with their stacks and posted amounts
     * @param config blinds, minimum bet and the caller's first actor
     * @return the initial state, already complete when nobody can act
     */
    public Result<BettingRoundState> startBettingRound(List<BettingRoundPlayerState> players, RoundConfig config) {
        PokerError problem = checkStart(players, config);
        if (problem != null) {
            log.info("Rejected betting round start: {}", problem.getMessage());
            return Result.error(problem);
        }

        List<BettingRoundPlayerState> seated = new ArrayList<>();
        ChipAmount betLevel = ChipAmount.zero();
        for (BettingRoundPlayerState player : players) {
            seated.add(player.toBuilder()
                .allIn(!player.isFolded() && player.getStack().isZero())
                .acted(false)
                .build());
            betLevel = ChipAmount.max(betLevel, player.getCommitted());
        }

        Set<String> pending = new LinkedHashSet<>();
        for (BettingRoundPlayerState player : seated) {
            if (player.canAct()) {
                pending.add(player.getPlayerId());
            }
        }
        // A lone player with chips behind and nothing to call has nobody to bet against.
        if (pending.size() == 1) {
            BettingRoundPlayerState lone = seated.get(indexOf(seated, pending.iterator().next()));
            if (!lone.getCommitted().isLessThan(betLevel)) {
                pending.clear();
            }
        }

        BettingRoundState.BettingRoundStateBuilder builder = BettingRoundState.builder()
            .players(Collections.unmodifiableList(seated))
            .betLevel(betLevel)
            .lastRaiseSize(config.getBigBlind())
            .bigBlind(config.getBigBlind())
            .minBet(config.effectiveMinBet())
            .actionLog(List.of());

        long live = seated.stream().filter(p -> !p.isFolded()).count();
        if (live <= 1 || pending.isEmpty()) {
            BettingRoundState state = complete(builder, seated);
            log.info("Betting round started complete: {} live player(s), pot {}", live, state.potTotal());
            return Result.ok(state);
        }

        int start = config.getFirstToActPlayerId() == null ? 0 : indexOf(seated, config.getFirstToActPlayerId());
        int actor = nextPending(seated, pending, start, 0);
        BettingRoundState state = builder
            .pendingPlayerIds(orderedPending(seated, pending))
            .actorIndex(actor)
            .phase(RoundPhase.AWAITING_ACTION)
            .pots(List.of())
            .build();

        log.info("Betting round started: {} players, bet level {}, {} to act",
            seated.size(), betLevel, state.getActingPlayerId());
        return Result.ok(state);
    }

    /**
     * Validate then apply a player's action.
     */
    public Result<BettingRoundState> submitAction(BettingRoundState state, PlayerAction action) {
        Result<BettingRoundState> result = actionValidator.validateAction(state, action)
            .flatMap(validated -> applyActionToBettingRound(state, validated));
        if (result.isError()) {
            log.info("Rejected {} by {}: {}", action.getType(), action.getPlayerId(), result.getError().getCode());
        }
        return result;
    }

    /**
     * Apply a validated action, producing the next state.
     *
     * @return the next state; INVALID_ACTION when the round is complete or the action is
     *         not from the player to act, INTERNAL_ERROR when the action was validated
     *         against a different state
     */
    public Result<BettingRoundState> applyActionToBettingRound(BettingRoundState state, ValidatedAction action) {
        if (state.isComplete()) {
            return Result.error(PokerError.of(ErrorCode.INVALID_ACTION,
                "Betting round is already complete", "playerId", action.getPlayerId()));
        }
        String acting = state.getActingPlayerId();
        if (!action.getPlayerId().equals(acting)) {
            return Result.error(PokerError.of(ErrorCode.INVALID_ACTION,
                "Player " + action.getPlayerId() + " is not the player to act",
                "playerId", action.getPlayerId(), "actingPlayerId", acting));
        }
        if (!action.getBetLevelSeen().equals(state.getBetLevel())) {
            return Result.error(PokerError.of(ErrorCode.INTERNAL_ERROR,
                "Action was validated against bet level " + action.getBetLevelSeen()
                    + " but the round is at " + state.getBetLevel()));
        }

        try {
            return Result.ok(transition(state, action));
        } catch (PokerEngineException e) {
            log.error("Could not apply {} by {}", action.getType(), action.getPlayerId(), e);
            return Result.error(e.getError());
        }
    }

    /**
     * True when at most one live player remains or nobody still owes an action.
     */
    public boolean isBettingRoundComplete(BettingRoundState state) {
        return state.isComplete()
            || state.countLivePlayers() <= 1
            || state.getPendingPlayerIds().isEmpty();
    }

    public BettingRoundInfo getBettingRoundInfo(BettingRoundState state) {
        List<BettingRoundInfo.PlayerSnapshot> snapshots = new ArrayList<>();
        for (BettingRoundPlayerState player : state.getPlayers()) {
            snapshots.add(new BettingRoundInfo.PlayerSnapshot(
                player.getPlayerId(),
                player.getStack(),
                player.getCommitted(),
                player.isFolded(),
                player.isAllIn(),
                state.getPendingPlayerIds().contains(player.getPlayerId())));
        }

        return BettingRoundInfo.builder()
            .phase(state.getPhase())
            .potTotal(state.potTotal())
            .streetTotal(state.streetTotal())
            .pots(state.getPots())
            .currentBetLevel(state.getBetLevel())
            .minRaiseSize(state.getLastRaiseSize())
            .minRaiseTo(state.minRaiseTo())
            .players(List.copyOf(snapshots))
            .actingPlayerId(state.getActingPlayerId())
            .build();
    }

    /**
     * Re-run a recorded sequence of actions from a fresh start.
     *
     * @return the final state, or the error of the first action that was rejected
     */
    public Result<BettingRoundState> replay(List<BettingRoundPlayerState> players, RoundConfig config,
                                            List<PlayerAction> actions) {
        Result<BettingRoundState> result = startBettingRound(players, config);
        for (PlayerAction action : actions) {
            if (result.isError()) {
                return result;
            }
            BettingRoundState current = result.getValue();
            result = submitAction(current, action);
        }
        return result;
    }

    private BettingRoundState transition(BettingRoundState state, ValidatedAction action) {
        int index = state.getActorIndex();
        BettingRoundPlayerState player = state.getPlayers().get(index);
        ChipAmount chips = action.getChips();
        if (chips.isNegative() || chips.isGreaterThan(player.getStack())
            || !player.getCommitted().add(chips).equals(action.getCommittedAfter())) {
            throw new PokerEngineException(PokerError.of(ErrorCode.INTERNAL_ERROR,
                "Action by " + player.getPlayerId() + " does not match the state it is applied to",
                "chips", chips, "stack", player.getStack(), "committed", player.getCommitted()));
        }

        boolean folded = action.getType() == PlayerActionType.FOLD;
        ChipAmount stack = player.getStack().subtract(chips);
        BettingRoundPlayerState updated = player.toBuilder()
            .stack(stack)
            .committed(action.getCommittedAfter())
            .folded(folded)
            .allIn(!folded && stack.isZero())
            .acted(true)
            .build();

        List<BettingRoundPlayerState> players = new ArrayList<>(state.getPlayers());
        players.set(index, updated);

        Set<String> pending = new HashSet<>(state.getPendingPlayerIds());
        pending.remove(player.getPlayerId());

        ChipAmount betLevel = state.getBetLevel();
        ChipAmount lastRaiseSize = state.getLastRaiseSize();
        if (action.getCommittedAfter().isGreaterThan(betLevel)) {
            ChipAmount increment = action.getCommittedAfter().subtract(betLevel);
            ChipAmount fullSize = betLevel.isZero() ? state.getMinBet() : lastRaiseSize;
            boolean fullRaise = increment.isGreaterThanOrEqual(fullSize);
            betLevel = action.getCommittedAfter();
            for (int i = 0; i < players.size(); i++) {
                BettingRoundPlayerState other = players.get(i);
                if (i == index || !other.canAct()) {
                    continue;
                }
                if (fullRaise) {
                    players.set(i, other.toBuilder().acted(false).build());
                    pending.add(other.getPlayerId());
                } else if (other.getCommitted().isLessThan(betLevel)) {
                    // Short all-in: owed the difference, but raising stays closed for anyone who acted.
                    pending.add(other.getPlayerId());
                }
            }
            if (fullRaise) {
                lastRaiseSize = increment;
            }
        }

        List<ActionLogEntry> entries = new ArrayList<>(state.getActionLog());
        entries.add(new ActionLogEntry(entries.size() + 1, player.getPlayerId(), action.getType(),
            chips, action.getCommittedAfter(), betLevel));

        BettingRoundState.BettingRoundStateBuilder builder = state.toBuilder()
            .players(Collections.unmodifiableList(players))
            .betLevel(betLevel)
            .lastRaiseSize(lastRaiseSize)
            .actionLog(Collections.unmodifiableList(entries));

        long live = players.stream().filter(p -> !p.isFolded()).count();
        BettingRoundState next;
        if (live <= 1 || pending.isEmpty()) {
            next = complete(builder, players);
        } else {
            next = builder
                .pendingPlayerIds(orderedPending(players, pending))
                .actorIndex(nextPending(players, pending, index, 1))
                .build();
        }

        if (!next.chipsInPlay().equals(state.chipsInPlay())) {
            throw new PokerEngineException(PokerError.of(ErrorCode.INTERNAL_ERROR,
                "Chip conservation broken applying " + action.getType() + " by " + player.getPlayerId(),
                "before", state.chipsInPlay(), "after", next.chipsInPlay()));
        }

        log.debug("Applied {} by {}: {} chips, bet level {}, next {}",
            action.getType(), player.getPlayerId(), chips, betLevel, next.getActingPlayerId());
        if (next.isComplete()) {
            log.info("Betting round complete after {} action(s): pot {} in {} pot(s)",
                entries.size(), next.potTotal(), next.getPots().size());
        }
        return next;
    }

    private BettingRoundState complete(BettingRoundState.BettingRoundStateBuilder builder,
                                       List<BettingRoundPlayerState> players) {
        return builder
            .phase(RoundPhase.COMPLETE)
            .actorIndex(null)
            .pendingPlayerIds(Collections.emptySet())
            .pots(potCalculator.computePots(players))
            .build();
    }

    private PokerError checkStart(List<BettingRoundPlayerState> players, RoundConfig config) {
        if (config == null || config.getBigBlind() == null || !config.getBigBlind().isPositive()) {
            return PokerError.of(ErrorCode.INVALID_STATE, "Big blind must be positive");
        }
        if (!config.effectiveMinBet().isPositive()) {
            return PokerError.of(ErrorCode.INVALID_STATE, "Minimum bet must be positive");
        }
        if (players == null || players.size() < 2) {
            return PokerError.of(ErrorCode.NOT_ENOUGH_PLAYERS, "A betting round needs at least 2 players",
                "players", players == null ? 0 : players.size());
        }
        Set<String> ids = new HashSet<>();
        for (BettingRoundPlayerState player : players) {
            if (player.getPlayerId() == null || !ids.add(player.getPlayerId())) {
                return PokerError.of(ErrorCode.INVALID_STATE, "Duplicate or missing player id: " + player.getPlayerId());
            }
            if (isNegative(player.getStack()) || isNegative(player.getCommitted())
                || isNegative(player.getPriorContribution())) {
                return PokerError.of(ErrorCode.INVALID_STATE,
                    "Player " + player.getPlayerId() + " has a missing or negative chip amount");
            }
        }
        if (config.getFirstToActPlayerId() != null && !ids.contains(config.getFirstToActPlayerId())) {
            return PokerError.of(ErrorCode.PLAYER_NOT_FOUND,
                "First player to act " + config.getFirstToActPlayerId() + " is not in the round");
        }
        return null;
    }

    private static boolean isNegative(ChipAmount amount) {
        return amount == null || amount.isNegative();
    }

    private static int indexOf(List<BettingRoundPlayerState> players, String playerId) {
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getPlayerId().equals(playerId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * First index at or after {@code from + offset}, wrapping around, whose player is pending.
     */
    private static int nextPending(List<BettingRoundPlayerState> players, Set<String> pending, int from, int offset) {
        int n = players.size();
        for (int k = 0; k < n; k++) {
            int i = (from + offset + k) % n;
            if (pending.contains(players.get(i).getPlayerId())) {
                return i;
            }
        }
        throw new PokerEngineException(PokerError.of(ErrorCode.INTERNAL_ERROR, "No pending player to act"));
    }

    private static Set<String> orderedPending(List<BettingRoundPlayerState> players, Set<String> pending) {
        Set<String> ordered = new LinkedHashSet<>();
        for (BettingRoundPlayerState player : players) {
            if (pending.contains(player.getPlayerId())) {
                ordered.add(player.getPlayerId());
            }
        }
        return Collections.unmodifiableSet(ordered);
    }
}
