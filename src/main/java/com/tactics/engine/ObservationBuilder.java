package com.tactics.engine;

import com.tactics.model.GameState;
import com.tactics.model.Unit;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flattens a game state into the numeric vector consumed by learning agents.
 * <p>
 * Layout: {@code [turn, phase, acting player, terminal]} followed by {@value #UNIT_WIDTH}
 * values per unit in scenario order: player, col, row, hp, hpMax, alive models, alive,
 * acted this phase, fled, charged.
 */
@Component
public class ObservationBuilder {

    public static final int HEADER_WIDTH = 4;
    public static final int UNIT_WIDTH = 10;

    public int size(int unitCount) {
        return HEADER_WIDTH + unitCount * UNIT_WIDTH;
    }

    public float[] build(GameState state) {
        List<Unit> units = state.getUnits();
        float[] obs = new float[size(units.size())];
        obs[0] = state.getTurnNumber();
        obs[1] = state.getCurrentPhase().ordinal();
        obs[2] = state.getCurrentPlayer();
        obs[3] = state.isFinished() ? 1f : 0f;

        int i = HEADER_WIDTH;
        for (Unit unit : units) {
            obs[i] = unit.getPlayer();
            obs[i + 1] = unit.getPosition().col();
            obs[i + 2] = unit.getPosition().row();
            obs[i + 3] = unit.getHp();
            obs[i + 4] = unit.getHpMax();
            obs[i + 5] = unit.getAliveModels();
            obs[i + 6] = unit.isAlive() ? 1f : 0f;
            obs[i + 7] = state.getActedThisPhase().contains(unit.getId()) ? 1f : 0f;
            obs[i + 8] = state.getFled().contains(unit.getId()) ? 1f : 0f;
            obs[i + 9] = state.getCharged().contains(unit.getId()) ? 1f : 0f;
            i += UNIT_WIDTH;
        }
        return obs;
    }
}
