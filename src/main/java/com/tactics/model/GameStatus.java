package com.tactics.model;

/**
 * Lifecycle status of an episode.
 */
public enum GameStatus {
    IN_PROGRESS,
    FINISHED,
    HALTED          // Stopped by an invariant violation
}
