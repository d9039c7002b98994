package com.tactics.config;

/**
 * Reward table, always from the acting player's point of view.
 */
public record RewardSettings(
        double move,
        double pass,
        double hit,
        double damagePoint,
        double kill,
        double chargeSuccess,
        double chargeFailed,
        double illegalAction,
        double win,
        double loss,
        double draw
) {

    public static RewardSettings defaults() {
        return new RewardSettings(0.0, -0.1, 0.2, 0.5, 3.0, 0.5, -0.2, -1.0, 10.0, -10.0, 0.0);
    }
}
