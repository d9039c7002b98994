package com.tactics.exception;

import lombok.Getter;

/**
 * An impossible game state (overlapping units, negative HP, unit off the board) detected
 * at runtime. Indicates an engine bug rather than a bad action and halts the episode.
 */
@Getter
public class InvariantViolationException extends RuntimeException {

    private final String stateDump;

    public InvariantViolationException(String message, String stateDump) {
        super(message + "\n" + stateDump);
        this.stateDump = stateDump;
    }
}
