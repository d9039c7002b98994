package com.tactics.bot;

import com.tactics.dto.ActionRequest;
import com.tactics.engine.TurnPhaseStateMachine;

import java.util.Random;

/**
 * Strategy interface for scripted players.
 * Implements the Strategy pattern for different bot difficulty levels.
 */
public interface BotStrategy {

    /**
     * Decide what the given unit of the acting player does in the current phase.
     * Implementations only read the machine; the caller submits the returned request.
     *
     * @param random the match's random source, so a seeded match replays identically
     */
    ActionRequest decide(TurnPhaseStateMachine machine, String unitId, Random random);

    /**
     * Get the difficulty level this strategy represents.
     */
    BotDifficulty getDifficulty();
}
