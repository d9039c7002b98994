package com.tactics.engine;

import com.tactics.config.RewardSettings;
import com.tactics.dto.AttackOutcome;
import com.tactics.dto.ChargeOutcome;
import com.tactics.model.GameState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps action outcomes to reward signals for the acting player.
 */
@Component
@RequiredArgsConstructor
public class RewardCalculator {

    private final RewardSettings rewards;

    public double illegalAction() {
        return rewards.illegalAction();
    }

    public double move() {
        return rewards.move();
    }

    public double pass() {
        return rewards.pass();
    }

    public double attack(AttackOutcome outcome) {
        double reward = outcome.damage() * rewards.damagePoint();
        if (outcome.hit()) {
            reward += rewards.hit();
        }
        if (outcome.targetDestroyed()) {
            reward += rewards.kill();
        }
        return reward;
    }

    public double charge(ChargeOutcome outcome) {
        return outcome.success() ? rewards.chargeSuccess() : rewards.chargeFailed();
    }

    /**
     * Bonus added on the step that ends the episode.
     */
    public double terminal(GameState state, int actingPlayer) {
        if (state.getWinner() == null) {
            return rewards.draw();
        }
        return state.getWinner() == actingPlayer ? rewards.win() : rewards.loss();
    }
}
