package com.tactics.config;

/**
 * Rule knobs shared by every episode.
 *
 * @param maxTurns          turn budget when the scenario does not set one
 * @param maxSteps          accepted-action budget per episode
 * @param chargeMaxDistance maximum hex distance between a charger and its target
 * @param checkInvariants   verify occupancy/HP/bounds after every accepted action
 */
public record EngineSettings(
        int maxTurns,
        int maxSteps,
        int chargeMaxDistance,
        boolean checkInvariants
) {

    public static EngineSettings defaults() {
        return new EngineSettings(5, 10_000, 12, true);
    }
}
