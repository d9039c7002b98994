package com.tactics.model;

/**
 * Represents the current phase within a player's turn.
 */
public enum GamePhase {
    MOVE,               // Units reposition on the board
    SHOOT,              // Ranged attacks against enemies in range and sight
    CHARGE,             // Melee units close the distance to an enemy
    FIGHT,              // Engaged units resolve melee attacks
    GAME_OVER;          // Episode has ended

    /**
     * Phase that follows this one within the same player's turn, or {@code null} after FIGHT.
     */
    public GamePhase next() {
        return switch (this) {
            case MOVE -> SHOOT;
            case SHOOT -> CHARGE;
            case CHARGE -> FIGHT;
            case FIGHT, GAME_OVER -> null;
        };
    }
}
