package com.tactics.exception;

/**
 * Reason codes attached to rejected actions.
 */
public enum RejectionReason {
    GAME_OVER,
    MALFORMED_REQUEST,
    UNKNOWN_UNIT,
    UNIT_DESTROYED,
    NOT_YOUR_TURN,
    WRONG_PHASE,
    ALREADY_ACTED,
    NOT_ELIGIBLE,
    MISSING_TARGET,
    OUT_OF_BOUNDS,
    WALL,
    OCCUPIED,
    SAME_HEX,
    NO_PATH,
    ENEMY_ADJACENT_DESTINATION,
    INVALID_TARGET,
    OUT_OF_RANGE,
    NO_LINE_OF_SIGHT,
    NO_WEAPON,
    FLED,
    ENGAGED,
    NOT_ADJACENT,
    DESTINATION_NOT_ADJACENT_TO_TARGET
}
