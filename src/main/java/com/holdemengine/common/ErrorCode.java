package com.holdemengine.common;

/**
 * Closed set of error codes surfaced by the engine.
 *
 * Callers branch on the code, never on message text. The betting core only produces
 * the validation and structural codes; the table, seat and card codes belong to the
 * collaborators that manage those concerns.
 */
public enum ErrorCode {
    /**
     * Action is not valid in the current round state.
     */
    INVALID_ACTION,

    /**
     * Player does not have enough chips for the action.
     */
    INSUFFICIENT_STACK,

    /**
     * Round or player is in a state that does not allow the operation.
     */
    INVALID_STATE,

    /**
     * Player is not part of the round.
     */
    PLAYER_NOT_FOUND,

    /**
     * Another player is due to act.
     */
    NOT_PLAYER_TURN,

    /**
     * Bet amount is outside the legal bounds.
     */
    INVALID_BET_AMOUNT,

    /**
     * Raise amount is outside the legal bounds.
     */
    INVALID_RAISE_AMOUNT,

    TABLE_FULL,

    TABLE_EMPTY,

    SEAT_OCCUPIED,

    INVALID_SEAT,

    GAME_ALREADY_STARTED,

    GAME_NOT_STARTED,

    INVALID_CARD,

    /**
     * Fewer players than a round needs.
     */
    NOT_ENOUGH_PLAYERS,

    /**
     * Engine invariant broken; indicates a caller or engine defect.
     */
    INTERNAL_ERROR
}
