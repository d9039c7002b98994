package com.tactics.model;

/**
 * Why an episode reached a terminal state.
 */
public enum EndReason {
    ELIMINATION,    // One player has no live unit left
    TURN_LIMIT,     // Turn budget exhausted
    STEP_LIMIT      // Accepted-action budget exhausted
}
