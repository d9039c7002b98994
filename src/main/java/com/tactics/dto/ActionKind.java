package com.tactics.dto;

import com.tactics.model.GamePhase;

/**
 * Kinds of action a unit can take. Each kind except PASS belongs to exactly one phase.
 */
public enum ActionKind {
    MOVE(GamePhase.MOVE),
    SHOOT(GamePhase.SHOOT),
    CHARGE(GamePhase.CHARGE),
    FIGHT(GamePhase.FIGHT),
    PASS(null);

    private final GamePhase phase;

    ActionKind(GamePhase phase) {
        this.phase = phase;
    }

    public boolean allowedIn(GamePhase current) {
        return phase == null || phase == current;
    }
}
