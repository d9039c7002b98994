package com.tactics.bot;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Factory for resolving bot strategies by difficulty level.
 */
@Service
@RequiredArgsConstructor
public class BotStrategyFactory {

    private final RandomBotStrategy randomStrategy;
    private final GreedyBotStrategy greedyStrategy;
    private final DefensiveBotStrategy defensiveStrategy;

    public BotStrategy getStrategy(BotDifficulty difficulty) {
        if (difficulty == null) {
            difficulty = BotDifficulty.MEDIUM;
        }

        return switch (difficulty) {
            case EASY -> randomStrategy;
            case MEDIUM -> greedyStrategy;
            case HARD -> defensiveStrategy;
        };
    }
}
