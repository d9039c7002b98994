package com.tactics.bot;

/**
 * Scripted opponent levels.
 */
public enum BotDifficulty {
    EASY,
    MEDIUM,
    HARD
}
