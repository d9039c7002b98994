package com.tactics.exception;

import lombok.Getter;

/**
 * A player action that breaks a game rule. Recoverable: the episode continues and the
 * state machine reports the rejection to its caller instead of propagating this exception.
 */
@Getter
public class IllegalActionException extends RuntimeException {

    private final RejectionReason reason;

    public IllegalActionException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
