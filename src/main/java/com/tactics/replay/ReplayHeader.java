package com.tactics.replay;

/**
 * First line of a replay log: what is needed to recreate the episode.
 */
public record ReplayHeader(int formatVersion, String scenarioId, long seed) {

    public static final int CURRENT_VERSION = 1;

    public static ReplayHeader of(String scenarioId, long seed) {
        return new ReplayHeader(CURRENT_VERSION, scenarioId, seed);
    }
}
